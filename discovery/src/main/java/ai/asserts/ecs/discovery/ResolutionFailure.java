/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ResolutionFailure {
    private final String clusterArn;
    private final String taskArn;
    private final String containerName;
    private final FailureReason reason;
    private final String message;
}
