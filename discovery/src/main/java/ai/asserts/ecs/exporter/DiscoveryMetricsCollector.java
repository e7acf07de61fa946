/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.exporter;

import ai.asserts.ecs.DiscoveryTaskManager;
import ai.asserts.ecs.discovery.DiscoveryResult;
import ai.asserts.ecs.discovery.FailureReason;
import ai.asserts.ecs.discovery.ResolutionFailure;
import ai.asserts.ecs.discovery.TaskDefinitionCache;
import ai.asserts.ecs.inventory.EcsInstanceCache;
import com.google.common.cache.CacheStats;
import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples.Sample;
import io.prometheus.client.CollectorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gauges describing the latest discovery cycle.
 */
@Component
@Slf4j
public class DiscoveryMetricsCollector extends Collector implements InitializingBean {
    public static final String TARGETS_METRIC = "ecs_sd_targets";
    public static final String FAILURES_METRIC = "ecs_sd_resolution_failures";
    public static final String CACHE_SIZE_METRIC = "ecs_sd_task_definition_cache_size";
    public static final String CACHE_REQUESTS_METRIC = "ecs_sd_task_definition_cache_requests";
    public static final String INSTANCE_CACHE_SIZE_METRIC = "ecs_sd_instance_cache_size";
    public static final String INSTANCE_CACHE_REQUESTS_METRIC = "ecs_sd_instance_cache_requests";
    public static final String CACHE_LABEL = "cache";
    public static final String BUCKET_LABEL = "bucket";
    public static final String REASON_LABEL = "reason";
    public static final String RESULT_LABEL = "result";

    private final DiscoveryTaskManager discoveryTaskManager;
    private final TaskDefinitionCache taskDefinitionCache;
    private final EcsInstanceCache instanceCache;
    private final CollectorRegistry collectorRegistry;

    public DiscoveryMetricsCollector(DiscoveryTaskManager discoveryTaskManager,
                                     TaskDefinitionCache taskDefinitionCache,
                                     EcsInstanceCache instanceCache,
                                     CollectorRegistry collectorRegistry) {
        this.discoveryTaskManager = discoveryTaskManager;
        this.taskDefinitionCache = taskDefinitionCache;
        this.instanceCache = instanceCache;
        this.collectorRegistry = collectorRegistry;
    }

    @Override
    public void afterPropertiesSet() {
        collectorRegistry.register(this);
    }

    @Override
    public List<MetricFamilySamples> collect() {
        DiscoveryResult result = discoveryTaskManager.getLatestResult();
        List<MetricFamilySamples> familySamples = new ArrayList<>();

        List<Sample> targetSamples = new ArrayList<>();
        result.getBuckets().forEach((bucket, targets) -> targetSamples.add(
                sample(TARGETS_METRIC, BUCKET_LABEL, bucket, targets.size())));
        buildFamily(targetSamples).ifPresent(familySamples::add);

        Map<FailureReason, Integer> failureCounts = new EnumMap<>(FailureReason.class);
        for (FailureReason reason : FailureReason.values()) {
            failureCounts.put(reason, 0);
        }
        result.getFailures().stream()
                .map(ResolutionFailure::getReason)
                .forEach(reason -> failureCounts.merge(reason, 1, Integer::sum));
        List<Sample> failureSamples = new ArrayList<>();
        failureCounts.forEach((reason, count) -> failureSamples.add(
                sample(FAILURES_METRIC, REASON_LABEL, reason.name(), count)));
        buildFamily(failureSamples).ifPresent(familySamples::add);

        CacheStats stats = taskDefinitionCache.stats();
        buildFamily(Collections.singletonList(
                new Sample(CACHE_SIZE_METRIC, Collections.emptyList(), Collections.emptyList(),
                        taskDefinitionCache.size()))).ifPresent(familySamples::add);
        List<Sample> cacheSamples = new ArrayList<>();
        cacheSamples.add(sample(CACHE_REQUESTS_METRIC, RESULT_LABEL, "hit", stats.hitCount()));
        cacheSamples.add(sample(CACHE_REQUESTS_METRIC, RESULT_LABEL, "miss", stats.missCount()));
        cacheSamples.add(sample(CACHE_REQUESTS_METRIC, RESULT_LABEL, "load_failure", stats.loadExceptionCount()));
        buildFamily(cacheSamples).ifPresent(familySamples::add);

        buildFamily(Arrays.asList(
                sample(INSTANCE_CACHE_SIZE_METRIC, CACHE_LABEL, "container_instance",
                        instanceCache.containerInstanceCount()),
                sample(INSTANCE_CACHE_SIZE_METRIC, CACHE_LABEL, "ec2_instance",
                        instanceCache.ec2InstanceCount()))).ifPresent(familySamples::add);
        List<Sample> instanceSamples = new ArrayList<>();
        addRequestSamples(instanceSamples, "container_instance", instanceCache.containerInstanceStats());
        addRequestSamples(instanceSamples, "ec2_instance", instanceCache.ec2InstanceStats());
        buildFamily(instanceSamples).ifPresent(familySamples::add);
        return familySamples;
    }

    private void addRequestSamples(List<Sample> samples, String cache, CacheStats stats) {
        List<String> labelNames = Arrays.asList(CACHE_LABEL, RESULT_LABEL);
        samples.add(new Sample(INSTANCE_CACHE_REQUESTS_METRIC, labelNames, Arrays.asList(cache, "hit"),
                stats.hitCount()));
        samples.add(new Sample(INSTANCE_CACHE_REQUESTS_METRIC, labelNames, Arrays.asList(cache, "miss"),
                stats.missCount()));
    }

    private Sample sample(String metricName, String labelName, String labelValue, double value) {
        return new Sample(metricName, Collections.singletonList(labelName), Collections.singletonList(labelValue),
                value);
    }

    private Optional<MetricFamilySamples> buildFamily(List<Sample> samples) {
        if (samples.size() > 0) {
            return Optional.of(new MetricFamilySamples(samples.get(0).name, Type.GAUGE, "", samples));
        }
        return Optional.empty();
    }
}
