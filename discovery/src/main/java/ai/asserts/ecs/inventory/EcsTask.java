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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EcsTask {
    public static final String RUNNING = "RUNNING";

    private final String arn;
    private final String taskId;
    private final String clusterArn;
    /**
     * Set when the task was started by a service.
     */
    private final String serviceName;
    private final String taskDefinitionArn;
    @Builder.Default
    private final LaunchType launchType = LaunchType.EC2;
    private final String lastStatus;
    /**
     * Network mode reported with the task. The task definition's mode takes precedence.
     */
    private final NetworkMode networkMode;
    /**
     * Private IP of the elastic network interface attached to the task.
     */
    private final String eniAddress;
    /**
     * Private IP of the container instance hosting the task.
     */
    private final String hostAddress;
    private final String ec2InstanceId;
    private final String availabilityZone;
    @Builder.Default
    private final Map<String, String> tags = new LinkedHashMap<>();
    @Builder.Default
    private final List<EcsContainer> containers = new ArrayList<>();

    public boolean isRunning() {
        return lastStatus == null || RUNNING.equalsIgnoreCase(lastStatus);
    }
}
