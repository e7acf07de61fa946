/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A running instance of a container definition.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EcsContainer {
    private final String name;
    private final String arn;
    private final String containerId;
    @Builder.Default
    private final List<EcsNetworkBinding> networkBindings = new ArrayList<>();
}
