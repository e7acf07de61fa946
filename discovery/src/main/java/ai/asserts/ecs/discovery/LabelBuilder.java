/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.LabelNameUtil;
import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.inventory.EcsCluster;
import ai.asserts.ecs.inventory.EcsContainer;
import ai.asserts.ecs.inventory.EcsService;
import ai.asserts.ecs.inventory.EcsTask;
import ai.asserts.ecs.inventory.EcsTaskDefinition;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Component
@AllArgsConstructor
@Slf4j
public class LabelBuilder {
    private final LabelNameUtil labelNameUtil;

    /**
     * Labels of one scrape target. With <code>suppressLabels</code> set, the target carries no ECS labels and no
     * tags, only the job, the metrics path, the port and an <code>instance</code> label that names the job instead
     * of the container.
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public Labels buildLabels(EcsCluster cluster, Optional<EcsService> service, EcsTask task,
                              EcsTaskDefinition taskDefinition, EcsContainer container,
                              ResolvedPort resolvedPort, ScrapeEndpoint endpoint,
                              boolean suppressLabels, Map<String, String> tagLabels) {
        String job = getJobName(taskDefinition, container);
        if (suppressLabels) {
            return Labels.builder()
                    .job(job)
                    .metricsPath(endpoint.getPath())
                    .instance(job)
                    .port(String.valueOf(resolvedPort.getPort()))
                    .build()
                    .populateMapEntries();
        }

        Labels labels = Labels.builder()
                .job(job)
                .metricsPath(endpoint.getPath())
                .instance(resolvedPort.getAddress())
                .port(String.valueOf(resolvedPort.getPort()))
                .cluster(cluster.getName())
                .service(service.map(EcsService::getName).orElse(task.getServiceName()))
                .taskId(task.getTaskId())
                .taskFamily(taskDefinition.getFamily())
                .taskVersion(taskDefinition.getRevision() != null ? taskDefinition.getRevision().toString() : null)
                .container(container.getName())
                .containerId(container.getContainerId())
                .launchType(task.getLaunchType().getValue())
                .networkMode(resolvedPort.getNetworkMode().getValue())
                .availabilityZone(task.getAvailabilityZone())
                .ec2InstanceId(task.getEc2InstanceId())
                .build()
                .populateMapEntries();
        labels.putAll(tagLabels);
        return labels;
    }

    /**
     * Projects the opted-in tags into labels. Task definition tags are applied first, then service tags, then task
     * tags, so the most specific value wins when two tags normalize to the same label name.
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public Map<String, String> tagLabels(DiscoveryConfig discoveryConfig, EcsTaskDefinition taskDefinition,
                                         Optional<EcsService> service, EcsTask task) {
        Map<String, String> labels = new TreeMap<>();
        if (discoveryConfig.getTagExportConfig() == null || !discoveryConfig.getTagExportConfig().isEnabled()) {
            return labels;
        }
        addTagLabels(discoveryConfig, labels, taskDefinition.getTags());
        service.ifPresent(ecsService -> addTagLabels(discoveryConfig, labels, ecsService.getTags()));
        addTagLabels(discoveryConfig, labels, task.getTags());
        return labels;
    }

    private void addTagLabels(DiscoveryConfig discoveryConfig, Map<String, String> labels, Map<String, String> tags) {
        if (!CollectionUtils.isEmpty(tags)) {
            tags.entrySet().stream()
                    .filter(tag -> tag.getValue() != null)
                    .filter(tag -> discoveryConfig.shouldExportTag(tag.getKey()))
                    .forEach(tag -> labels.put(Labels.TAG_PREFIX + labelNameUtil.toLabelName(tag.getKey()),
                            tag.getValue()));
        }
    }

    private String getJobName(EcsTaskDefinition taskDefinition, EcsContainer container) {
        return taskDefinition.getFamily() != null ? taskDefinition.getFamily() : container.getName();
    }
}
