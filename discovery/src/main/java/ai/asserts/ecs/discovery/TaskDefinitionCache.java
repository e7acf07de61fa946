/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.inventory.EcsTaskDefinition;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader.InvalidCacheLoadException;
import com.google.common.cache.CacheStats;
import com.google.common.util.concurrent.UncheckedExecutionException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Task definitions by ARN. Many tasks share a task definition and a given ARN never changes, so entries are kept
 * across discovery cycles. Entries are evicted least recently used first once the cache is full and, when an expiry
 * is configured, after they have not been read for that long. Failed loads are not cached.
 */
@Slf4j
public class TaskDefinitionCache {
    private final TaskDefinitionLoader loader;
    private final Cache<String, EcsTaskDefinition> taskDefsByARN;

    public TaskDefinitionCache(TaskDefinitionLoader loader, long maximumSize) {
        this(loader, maximumSize, null, Ticker.systemTicker());
    }

    public TaskDefinitionCache(TaskDefinitionLoader loader, long maximumSize, Duration expireAfterAccess,
                               Ticker ticker) {
        this.loader = loader;
        CacheBuilder<Object, Object> builder = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .recordStats();
        if (expireAfterAccess != null) {
            builder = builder.expireAfterAccess(expireAfterAccess.toMillis(), TimeUnit.MILLISECONDS);
        }
        this.taskDefsByARN = builder.build();
    }

    public Optional<EcsTaskDefinition> get(String taskDefinitionArn) {
        if (taskDefinitionArn == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(taskDefsByARN.get(taskDefinitionArn, () -> loader.load(taskDefinitionArn)));
        } catch (InvalidCacheLoadException e) {
            log.warn("Task definition {} not found", taskDefinitionArn);
        } catch (ExecutionException | UncheckedExecutionException e) {
            log.error("Failed to load task definition {}", taskDefinitionArn, e.getCause());
        }
        return Optional.empty();
    }

    public CacheStats stats() {
        return taskDefsByARN.stats();
    }

    public long size() {
        return taskDefsByARN.size();
    }

    public void invalidateAll() {
        taskDefsByARN.invalidateAll();
    }
}
