/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.inventory.EcsTaskDefinition;

public interface TaskDefinitionLoader {
    /**
     * @return the task definition, or <code>null</code> if there is no task definition with this ARN.
     */
    EcsTaskDefinition load(String taskDefinitionArn) throws Exception;
}
