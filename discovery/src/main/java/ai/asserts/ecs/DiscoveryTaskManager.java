/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.discovery.DiscoveryResult;
import ai.asserts.ecs.discovery.IntervalBucketer;
import ai.asserts.ecs.discovery.TargetResolver;
import ai.asserts.ecs.discovery.TaskDefinitionCache;
import ai.asserts.ecs.exporter.ScrapeTargetFileWriter;
import ai.asserts.ecs.inventory.EcsInventoryCollector;
import ai.asserts.ecs.inventory.InventorySnapshot;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one discovery cycle at a time: collect the inventory, resolve targets, write the bucket files and publish
 * the result. A cycle that fails as a whole leaves the previous files and result in place.
 */
@Component
@Slf4j
public class DiscoveryTaskManager {
    private final EnvironmentConfig environmentConfig;
    private final DiscoveryConfigProvider discoveryConfigProvider;
    private final EcsInventoryCollector inventoryCollector;
    private final TargetResolver targetResolver;
    private final TaskDefinitionCache taskDefinitionCache;
    private final ScrapeTargetFileWriter fileWriter;
    private final IntervalBucketer intervalBucketer;
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<DiscoveryResult> latestResult = new AtomicReference<>();

    public DiscoveryTaskManager(EnvironmentConfig environmentConfig,
                                DiscoveryConfigProvider discoveryConfigProvider,
                                EcsInventoryCollector inventoryCollector, TargetResolver targetResolver,
                                TaskDefinitionCache taskDefinitionCache, ScrapeTargetFileWriter fileWriter,
                                IntervalBucketer intervalBucketer) {
        this.environmentConfig = environmentConfig;
        this.discoveryConfigProvider = discoveryConfigProvider;
        this.inventoryCollector = inventoryCollector;
        this.targetResolver = targetResolver;
        this.taskDefinitionCache = taskDefinitionCache;
        this.fileWriter = fileWriter;
        this.intervalBucketer = intervalBucketer;
    }

    /**
     * @return the result of the last completed cycle, or all buckets empty before the first one completes.
     */
    public DiscoveryResult getLatestResult() {
        DiscoveryResult result = latestResult.get();
        if (result == null) {
            DiscoveryConfig discoveryConfig = discoveryConfigProvider.getDiscoveryConfig();
            return targetResolver.resolve(InventorySnapshot.empty(), discoveryConfig, taskDefinitionCache);
        }
        return result;
    }

    @SuppressWarnings("unused")
    @Scheduled(fixedDelayString = "${ecs_sd.interval:60000}",
            initialDelayString = "${ecs_sd.initial_delay:5000}")
    @Timed(description = "Time spent discovering ECS scrape targets", histogram = true)
    public void discover() {
        if (environmentConfig.isDisabled()) {
            log.info("All processing off");
            return;
        }
        if (!cycleLock.tryLock()) {
            log.warn("Previous discovery cycle still running. Skipping this one");
            return;
        }
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Discovery cycle failed", e);
        } finally {
            cycleLock.unlock();
        }
    }

    @VisibleForTesting
    DiscoveryResult runCycle() {
        long tick = System.currentTimeMillis();
        discoveryConfigProvider.update();
        DiscoveryConfig discoveryConfig = discoveryConfigProvider.getDiscoveryConfig();
        InventorySnapshot snapshot = inventoryCollector.collect(discoveryConfig);
        DiscoveryResult result = targetResolver.resolve(snapshot, discoveryConfig, taskDefinitionCache);
        Set<String> failedBuckets = fileWriter.write(result, discoveryConfig.isLogTargets());
        if (!failedBuckets.isEmpty()) {
            log.error("Failed to write buckets {}", failedBuckets);
        }
        latestResult.set(result);
        log.info("Discovery cycle of {} took {}ms. {} targets in buckets {}, {} failures",
                result.getSnapshotTime(), System.currentTimeMillis() - tick, result.getTargetCount(),
                intervalBucketer.getBucketNames(discoveryConfig.getDefaultBucketName()), result.getFailures().size());
        return result;
    }

    @VisibleForTesting
    void setLatestResult(DiscoveryResult result) {
        latestResult.set(result);
    }
}
