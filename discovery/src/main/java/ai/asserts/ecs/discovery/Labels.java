/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.TreeMap;

import static org.springframework.util.StringUtils.hasLength;

@Getter
@Builder
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class Labels extends TreeMap<String, String> {
    public static final String METRICS_PATH = "__metrics_path__";
    public static final String JOB = "job";
    public static final String INSTANCE = "instance";
    public static final String PORT = "port";
    public static final String CLUSTER = "ecs_cluster";
    public static final String SERVICE = "ecs_service";
    public static final String TASK_ID = "ecs_task_id";
    public static final String TASK_FAMILY = "ecs_task_family";
    public static final String TASK_VERSION = "ecs_task_version";
    public static final String CONTAINER = "ecs_container";
    public static final String CONTAINER_ID = "ecs_container_id";
    public static final String LAUNCH_TYPE = "ecs_launch_type";
    public static final String NETWORK_MODE = "ecs_network_mode";
    public static final String AVAILABILITY_ZONE = "ecs_availability_zone";
    public static final String EC2_INSTANCE_ID = "instance_id";
    public static final String TAG_PREFIX = "tag_";

    private String metricsPath;
    private String job;
    private String instance;
    private String port;
    private String cluster;
    private String service;
    private String taskId;
    private String taskFamily;
    private String taskVersion;
    private String container;
    private String containerId;
    private String launchType;
    private String networkMode;
    private String availabilityZone;
    private String ec2InstanceId;

    public Labels populateMapEntries() {
        putIfSet(METRICS_PATH, metricsPath);
        putIfSet(JOB, job);
        putIfSet(INSTANCE, instance);
        putIfSet(PORT, port);
        putIfSet(CLUSTER, cluster);
        putIfSet(SERVICE, service);
        putIfSet(TASK_ID, taskId);
        putIfSet(TASK_FAMILY, taskFamily);
        putIfSet(TASK_VERSION, taskVersion);
        putIfSet(CONTAINER, container);
        putIfSet(CONTAINER_ID, containerId);
        putIfSet(LAUNCH_TYPE, launchType);
        putIfSet(NETWORK_MODE, networkMode);
        putIfSet(AVAILABILITY_ZONE, availabilityZone);
        putIfSet(EC2_INSTANCE_ID, ec2InstanceId);
        return this;
    }

    private void putIfSet(String name, String value) {
        if (hasLength(value)) {
            put(name, value);
        }
    }
}
