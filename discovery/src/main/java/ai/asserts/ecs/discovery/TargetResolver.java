/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.inventory.EcsCluster;
import ai.asserts.ecs.inventory.EcsContainer;
import ai.asserts.ecs.inventory.EcsContainerDefinition;
import ai.asserts.ecs.inventory.EcsService;
import ai.asserts.ecs.inventory.EcsTask;
import ai.asserts.ecs.inventory.EcsTaskDefinition;
import ai.asserts.ecs.inventory.InventorySnapshot;
import com.google.common.annotations.VisibleForTesting;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static ai.asserts.ecs.discovery.FailureReason.TASK_DEFINITION_UNAVAILABLE;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS_ENDPOINT;
import static ai.asserts.ecs.discovery.PrometheusEnv.PROMETHEUS_NOLABELS;
import static java.lang.String.format;

/**
 * Turns an inventory snapshot into scrape targets. A container that cannot be resolved is reported as a
 * {@link ResolutionFailure} and does not stop the rest of the cycle.
 */
@Component
@Slf4j
@AllArgsConstructor
public class TargetResolver {
    private final PortResolver portResolver;
    private final LabelBuilder labelBuilder;
    private final IntervalBucketer intervalBucketer;

    public DiscoveryResult resolve(InventorySnapshot snapshot, DiscoveryConfig discoveryConfig,
                                   TaskDefinitionCache taskDefinitionCache) {
        EndpointSpecParser endpointSpecParser = EndpointSpecParser.from(discoveryConfig);
        List<ScrapeTarget> targets = new ArrayList<>();
        List<ResolutionFailure> failures = new ArrayList<>();

        List<EcsCluster> clusters = snapshot != null ? snapshot.getClusters() : Collections.emptyList();
        clusters.stream()
                .filter(cluster -> discoveryConfig.shouldDiscoverCluster(cluster.getName(), cluster.getArn()))
                .forEach(cluster -> cluster.getTasks().stream()
                        .filter(EcsTask::isRunning)
                        .forEach(task -> resolveTask(discoveryConfig, taskDefinitionCache, endpointSpecParser,
                                cluster, task, targets, failures)));

        DiscoveryResult result = DiscoveryResult.builder()
                .snapshotTime(snapshot != null ? snapshot.getTakenAt() : Instant.now())
                .buckets(intervalBucketer.bucket(targets, discoveryConfig.getDefaultBucketName()))
                .failures(failures)
                .build();
        log.info("Resolved {} targets, {} failures", result.getTargetCount(), failures.size());
        return result;
    }

    @VisibleForTesting
    void resolveTask(DiscoveryConfig discoveryConfig, TaskDefinitionCache taskDefinitionCache,
                     EndpointSpecParser endpointSpecParser, EcsCluster cluster, EcsTask task,
                     List<ScrapeTarget> targets, List<ResolutionFailure> failures) {
        Optional<EcsTaskDefinition> taskDefinitionOpt = taskDefinitionCache.get(task.getTaskDefinitionArn());
        if (taskDefinitionOpt.isEmpty()) {
            // The eligible containers are unknown without the definition
            failures.add(failure(cluster, task, null, new PortResolutionException(TASK_DEFINITION_UNAVAILABLE,
                    format("Task definition %s is not available", task.getTaskDefinitionArn()))));
            return;
        }

        EcsTaskDefinition taskDefinition = taskDefinitionOpt.get();
        Optional<EcsService> service = cluster.getService(task.getServiceName());
        Map<String, String> tagLabels = null;
        for (EcsContainerDefinition containerDefinition : taskDefinition.getContainerDefinitions()) {
            if (!isScrapeEnabled(containerDefinition)) {
                continue;
            }
            if (tagLabels == null) {
                tagLabels = labelBuilder.tagLabels(discoveryConfig, taskDefinition, service, task);
            }
            boolean suppressLabels = containerDefinition.getEnvironmentVariable(PROMETHEUS_NOLABELS)
                    .map(PrometheusEnv::isTrue)
                    .orElse(false);
            List<ScrapeEndpoint> endpoints = endpointSpecParser.parse(
                    containerDefinition.getEnvironmentVariable(PROMETHEUS_ENDPOINT).orElse(null));

            for (EcsContainer container : getContainers(task, containerDefinition)) {
                try {
                    ResolvedPort resolvedPort = portResolver.resolve(task, taskDefinition, containerDefinition,
                            container);
                    for (ScrapeEndpoint endpoint : endpoints) {
                        targets.add(ScrapeTarget.builder()
                                .host(resolvedPort.getHost())
                                .port(resolvedPort.getPort())
                                .metricsPath(endpoint.getPath())
                                .interval(endpoint.getInterval())
                                .bucket(endpoint.getBucket())
                                .labels(labelBuilder.buildLabels(cluster, service, task, taskDefinition, container,
                                        resolvedPort, endpoint, suppressLabels, tagLabels))
                                .clusterArn(cluster.getArn())
                                .taskArn(task.getArn())
                                .containerName(containerDefinition.getName())
                                .build());
                    }
                } catch (PortResolutionException e) {
                    failures.add(failure(cluster, task, containerDefinition.getName(), e));
                }
            }
        }
    }

    @VisibleForTesting
    boolean isScrapeEnabled(EcsContainerDefinition containerDefinition) {
        return containerDefinition.getEnvironmentVariable(PROMETHEUS)
                .map(PrometheusEnv::isTrue)
                .orElse(false);
    }

    /**
     * Runtime containers matching the definition by name. A task that does not report its containers yet is
     * resolved against a container without network bindings.
     */
    @VisibleForTesting
    List<EcsContainer> getContainers(EcsTask task, EcsContainerDefinition containerDefinition) {
        List<EcsContainer> matching = task.getContainers().stream()
                .filter(container -> containerDefinition.getName().equals(container.getName()))
                .collect(Collectors.toList());
        if (matching.isEmpty()) {
            return Collections.singletonList(EcsContainer.builder()
                    .name(containerDefinition.getName())
                    .build());
        }
        return matching;
    }

    private ResolutionFailure failure(EcsCluster cluster, EcsTask task, String containerName,
                                      PortResolutionException e) {
        log.warn("Skipping {} of task {} in cluster {}: {}", containerName != null ? containerName : "containers",
                task.getArn(), cluster.getName(), e.getMessage());
        return ResolutionFailure.builder()
                .clusterArn(cluster.getArn())
                .taskArn(task.getArn())
                .containerName(containerName)
                .reason(e.getReason())
                .message(e.getMessage())
                .build();
    }
}
