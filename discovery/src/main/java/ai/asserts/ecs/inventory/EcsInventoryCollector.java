/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import ai.asserts.ecs.AWSApiCallRateLimiter;
import ai.asserts.ecs.AWSClientProvider;
import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.resource.Resource;
import ai.asserts.ecs.resource.ResourceMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.model.Cluster;
import software.amazon.awssdk.services.ecs.model.DescribeClustersRequest;
import software.amazon.awssdk.services.ecs.model.DescribeClustersResponse;
import software.amazon.awssdk.services.ecs.model.DescribeContainerInstancesRequest;
import software.amazon.awssdk.services.ecs.model.DescribeContainerInstancesResponse;
import software.amazon.awssdk.services.ecs.model.DescribeServicesRequest;
import software.amazon.awssdk.services.ecs.model.DescribeServicesResponse;
import software.amazon.awssdk.services.ecs.model.DescribeTasksRequest;
import software.amazon.awssdk.services.ecs.model.DescribeTasksResponse;
import software.amazon.awssdk.services.ecs.model.DesiredStatus;
import software.amazon.awssdk.services.ecs.model.ListClustersRequest;
import software.amazon.awssdk.services.ecs.model.ListClustersResponse;
import software.amazon.awssdk.services.ecs.model.ListServicesRequest;
import software.amazon.awssdk.services.ecs.model.ListServicesResponse;
import software.amazon.awssdk.services.ecs.model.ListTasksRequest;
import software.amazon.awssdk.services.ecs.model.ListTasksResponse;
import software.amazon.awssdk.services.ecs.model.ServiceField;
import software.amazon.awssdk.services.ecs.model.Task;
import software.amazon.awssdk.services.ecs.model.TaskField;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.stream.Collectors;

import static ai.asserts.ecs.AWSApiCallRateLimiter.OPERATION_LABEL;
import static ai.asserts.ecs.AWSApiCallRateLimiter.REGION_LABEL;

/**
 * Builds an {@link InventorySnapshot} of the ACTIVE clusters, their services and their RUNNING tasks. A failure in
 * one cluster is logged and that cluster is left out of the snapshot, the other clusters are still collected.
 */
@Component
@Slf4j
public class EcsInventoryCollector {
    public static final int DESCRIBE_SERVICES_BATCH_SIZE = 10;
    private final AWSClientProvider awsClientProvider;
    private final AWSApiCallRateLimiter rateLimiter;
    private final EcsModelMapper modelMapper;
    private final ResourceMapper resourceMapper;
    private final EcsInstanceCache instanceCache;
    private final int describeBatchSize;

    public EcsInventoryCollector(AWSClientProvider awsClientProvider, AWSApiCallRateLimiter rateLimiter,
                                 EcsModelMapper modelMapper, ResourceMapper resourceMapper,
                                 EcsInstanceCache instanceCache,
                                 @Value("${ecs_sd.describe_batch_size:100}") int describeBatchSize) {
        this.awsClientProvider = awsClientProvider;
        this.rateLimiter = rateLimiter;
        this.modelMapper = modelMapper;
        this.resourceMapper = resourceMapper;
        this.instanceCache = instanceCache;
        this.describeBatchSize = describeBatchSize;
    }

    public InventorySnapshot collect(DiscoveryConfig discoveryConfig) {
        EcsClient ecsClient = awsClientProvider.getEcsClient();
        List<EcsCluster> clusters = new ArrayList<>();
        for (Cluster cluster : getActiveClusters(ecsClient)) {
            if (!discoveryConfig.shouldDiscoverCluster(cluster.clusterName(), cluster.clusterArn())) {
                log.debug("Skipping cluster {}", cluster.clusterName());
                continue;
            }
            try {
                clusters.add(collectCluster(ecsClient, cluster));
            } catch (Exception e) {
                log.error("Failed to collect tasks of cluster " + cluster.clusterArn(), e);
            }
        }
        InventorySnapshot snapshot = InventorySnapshot.builder()
                .clusters(clusters)
                .build();
        log.info("Collected {} tasks from {} clusters", snapshot.getTaskCount(), clusters.size());
        log.info("Container instance cache: {}. EC2 instance cache: {}", instanceCache.containerInstanceStats(),
                instanceCache.ec2InstanceStats());
        return snapshot;
    }

    @VisibleForTesting
    List<Cluster> getActiveClusters(EcsClient ecsClient) {
        Set<String> allClusterARNs = new LinkedHashSet<>();
        String operationName = "EcsClient/listClusters";
        Paginator paginator = new Paginator();
        do {
            ListClustersRequest request = ListClustersRequest.builder()
                    .nextToken(paginator.getNextToken())
                    .build();
            ListClustersResponse response = rateLimiter.doWithRateLimit(operationName, labels(operationName),
                    () -> ecsClient.listClusters(request));
            if (response.hasClusterArns()) {
                allClusterARNs.addAll(response.clusterArns());
            }
            paginator.nextToken(response.nextToken());
        } while (paginator.hasNext());
        log.info("Found {} total clusters : {}", allClusterARNs.size(), allClusterARNs);

        List<Cluster> clusters = new ArrayList<>();
        String describeOperation = "EcsClient/describeClusters";
        for (List<String> batch : Lists.partition(new ArrayList<>(allClusterARNs), describeBatchSize)) {
            DescribeClustersRequest request = DescribeClustersRequest.builder()
                    .clusters(batch)
                    .build();
            DescribeClustersResponse response = rateLimiter.doWithRateLimit(describeOperation,
                    labels(describeOperation), () -> ecsClient.describeClusters(request));
            if (response.hasClusters()) {
                clusters.addAll(response.clusters().stream()
                        .filter(cluster -> "ACTIVE".equals(cluster.status()))
                        .collect(Collectors.toList()));
            }
        }
        log.info("Found {} ACTIVE clusters", clusters.size());
        return clusters;
    }

    @VisibleForTesting
    EcsCluster collectCluster(EcsClient ecsClient, Cluster cluster) {
        List<EcsService> services = getServices(ecsClient, cluster);
        List<Task> tasks = getTasks(ecsClient, cluster);
        Map<String, String> instanceIdByContainerInstance = getEC2InstanceIds(ecsClient, cluster, tasks);
        Map<String, String> ipByInstanceId = getPrivateIPs(new LinkedHashSet<>(
                instanceIdByContainerInstance.values()));

        List<EcsTask> ecsTasks = tasks.stream()
                .map(task -> {
                    String instanceId = task.containerInstanceArn() != null ?
                            instanceIdByContainerInstance.get(task.containerInstanceArn()) : null;
                    String hostAddress = instanceId != null ? ipByInstanceId.get(instanceId) : null;
                    return modelMapper.toTask(task, hostAddress, instanceId);
                })
                .collect(Collectors.toList());
        log.info("Found {} services and {} tasks in cluster {}", services.size(), ecsTasks.size(),
                cluster.clusterName());
        return EcsCluster.builder()
                .arn(cluster.clusterArn())
                .name(cluster.clusterName() != null ? cluster.clusterName() :
                        resourceMapper.map(cluster.clusterArn()).map(Resource::getName).orElse(null))
                .services(services)
                .tasks(ecsTasks)
                .build();
    }

    @VisibleForTesting
    List<EcsService> getServices(EcsClient ecsClient, Cluster cluster) {
        List<String> serviceARNs = new ArrayList<>();
        String operationName = "EcsClient/listServices";
        Paginator paginator = new Paginator();
        do {
            ListServicesRequest request = ListServicesRequest.builder()
                    .cluster(cluster.clusterArn())
                    .nextToken(paginator.getNextToken())
                    .build();
            ListServicesResponse response = rateLimiter.doWithRateLimit(operationName, labels(operationName),
                    () -> ecsClient.listServices(request));
            if (response.hasServiceArns()) {
                serviceARNs.addAll(response.serviceArns());
            }
            paginator.nextToken(response.nextToken());
        } while (paginator.hasNext());

        List<EcsService> services = new ArrayList<>();
        String describeOperation = "EcsClient/describeServices";
        for (List<String> batch : Lists.partition(serviceARNs, DESCRIBE_SERVICES_BATCH_SIZE)) {
            DescribeServicesRequest request = DescribeServicesRequest.builder()
                    .cluster(cluster.clusterArn())
                    .services(batch)
                    .include(ServiceField.TAGS)
                    .build();
            DescribeServicesResponse response = rateLimiter.doWithRateLimit(describeOperation,
                    labels(describeOperation), () -> ecsClient.describeServices(request));
            if (response.hasServices()) {
                response.services().stream()
                        .map(modelMapper::toService)
                        .forEach(services::add);
            }
        }
        return services;
    }

    @VisibleForTesting
    List<Task> getTasks(EcsClient ecsClient, Cluster cluster) {
        List<String> taskARNs = new ArrayList<>();
        String operationName = "EcsClient/listTasks";
        Paginator paginator = new Paginator();
        do {
            ListTasksRequest request = ListTasksRequest.builder()
                    .cluster(cluster.clusterArn())
                    .desiredStatus(DesiredStatus.RUNNING)
                    .nextToken(paginator.getNextToken())
                    .build();
            ListTasksResponse response = rateLimiter.doWithRateLimit(operationName, labels(operationName),
                    () -> ecsClient.listTasks(request));
            if (response.hasTaskArns()) {
                taskARNs.addAll(response.taskArns());
            }
            paginator.nextToken(response.nextToken());
        } while (paginator.hasNext());

        List<Task> tasks = new ArrayList<>();
        String describeOperation = "EcsClient/describeTasks";
        for (List<String> batch : Lists.partition(taskARNs, describeBatchSize)) {
            DescribeTasksRequest request = DescribeTasksRequest.builder()
                    .cluster(cluster.clusterArn())
                    .tasks(batch)
                    .include(TaskField.TAGS)
                    .build();
            DescribeTasksResponse response = rateLimiter.doWithRateLimit(describeOperation,
                    labels(describeOperation), () -> ecsClient.describeTasks(request));
            if (response.hasTasks()) {
                tasks.addAll(response.tasks());
            }
        }
        return tasks;
    }

    @VisibleForTesting
    Map<String, String> getEC2InstanceIds(EcsClient ecsClient, Cluster cluster, List<Task> tasks) {
        List<String> containerInstanceARNs = tasks.stream()
                .map(Task::containerInstanceArn)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
        Map<String, String> instanceIds = new HashMap<>();
        Set<String> missing = instanceCache.getInstanceIds(containerInstanceARNs, instanceIds);
        Map<String, String> described = new HashMap<>();
        String operationName = "EcsClient/describeContainerInstances";
        for (List<String> batch : Lists.partition(new ArrayList<>(missing), describeBatchSize)) {
            DescribeContainerInstancesRequest request = DescribeContainerInstancesRequest.builder()
                    .cluster(cluster.clusterArn())
                    .containerInstances(batch)
                    .build();
            DescribeContainerInstancesResponse response = rateLimiter.doWithRateLimit(operationName,
                    labels(operationName), () -> ecsClient.describeContainerInstances(request));
            if (response.hasContainerInstances()) {
                response.containerInstances().stream()
                        .filter(instance -> instance.ec2InstanceId() != null)
                        .forEach(instance -> described.put(instance.containerInstanceArn(),
                                instance.ec2InstanceId()));
            }
        }
        instanceCache.putInstanceIds(described);
        instanceIds.putAll(described);
        return instanceIds;
    }

    @VisibleForTesting
    Map<String, String> getPrivateIPs(Set<String> instanceIds) {
        Map<String, String> ipByInstanceId = new HashMap<>();
        Set<String> missing = instanceCache.getPrivateIPs(instanceIds, ipByInstanceId);
        if (missing.isEmpty()) {
            return ipByInstanceId;
        }
        Map<String, String> described = new HashMap<>();
        Ec2Client ec2Client = awsClientProvider.getEc2Client();
        String operationName = "Ec2Client/describeInstances";
        for (List<String> batch : Lists.partition(new ArrayList<>(missing), describeBatchSize)) {
            Paginator paginator = new Paginator();
            do {
                DescribeInstancesRequest request = DescribeInstancesRequest.builder()
                        .instanceIds(batch)
                        .nextToken(paginator.getNextToken())
                        .build();
                DescribeInstancesResponse response = rateLimiter.doWithRateLimit(operationName,
                        labels(operationName), () -> ec2Client.describeInstances(request));
                if (response.hasReservations()) {
                    response.reservations().stream()
                            .flatMap(reservation -> reservation.instances().stream())
                            .filter(instance -> instance.privateIpAddress() != null)
                            .forEach(instance -> described.put(instance.instanceId(),
                                    instance.privateIpAddress()));
                }
                paginator.nextToken(response.nextToken());
            } while (paginator.hasNext());
        }
        instanceCache.putPrivateIPs(described);
        ipByInstanceId.putAll(described);
        return ipByInstanceId;
    }

    private SortedMap<String, String> labels(String operationName) {
        return ImmutableSortedMap.of(
                REGION_LABEL, awsClientProvider.getRegion(),
                OPERATION_LABEL, operationName);
    }
}
