/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EcsPortMapping {
    private final Integer containerPort;
    /**
     * Only set when the definition asks for a fixed host port.
     */
    private final Integer hostPort;
}
