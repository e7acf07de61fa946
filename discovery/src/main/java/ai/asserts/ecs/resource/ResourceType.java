/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.resource;

public enum ResourceType {
    ECSCluster,
    ECSService,
    ECSTask,
    ECSTaskDef,
    ECSContainer,
    EC2Instance
}
