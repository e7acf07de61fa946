/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.resource;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode()
@Builder
@ToString
public class Resource {
    private final ResourceType type;
    private final String name;
    private final String region;
    private final String account;

    /**
     * Revision of a task definition. See {@link ResourceMapper#ECS_TASK_DEFINITION_PATTERN}
     */
    private final String version;

    /**
     * Tasks, services and containers also carry the cluster they belong to, when the ARN names it.
     */
    private final Resource childOf;
    @EqualsAndHashCode.Exclude
    private final String arn;
}
