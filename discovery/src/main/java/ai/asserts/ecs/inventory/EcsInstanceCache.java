/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Container instance to EC2 instance id, and EC2 instance id to private IP. Hosts outlive the tasks placed on them,
 * so lookups are kept across discovery cycles and dropped once a host has not been seen for the expiry.
 */
public class EcsInstanceCache {
    private final Cache<String, String> instanceIdsByContainerInstance;
    private final Cache<String, String> privateIPsByInstanceId;

    public EcsInstanceCache(Duration expireAfterAccess, Ticker ticker) {
        this.instanceIdsByContainerInstance = newCache(expireAfterAccess, ticker);
        this.privateIPsByInstanceId = newCache(expireAfterAccess, ticker);
    }

    private static Cache<String, String> newCache(Duration expireAfterAccess, Ticker ticker) {
        return CacheBuilder.newBuilder()
                .expireAfterAccess(expireAfterAccess.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    /**
     * Fills <code>found</code> with the cached instance ids and returns the container instances that must be
     * described.
     */
    public Set<String> getInstanceIds(Collection<String> containerInstanceARNs, Map<String, String> found) {
        return lookup(instanceIdsByContainerInstance, containerInstanceARNs, found);
    }

    public void putInstanceIds(Map<String, String> instanceIds) {
        instanceIdsByContainerInstance.putAll(instanceIds);
    }

    /**
     * Fills <code>found</code> with the cached private IPs and returns the instances that must be described.
     */
    public Set<String> getPrivateIPs(Collection<String> instanceIds, Map<String, String> found) {
        return lookup(privateIPsByInstanceId, instanceIds, found);
    }

    public void putPrivateIPs(Map<String, String> privateIPs) {
        privateIPsByInstanceId.putAll(privateIPs);
    }

    public CacheStats containerInstanceStats() {
        return instanceIdsByContainerInstance.stats();
    }

    public CacheStats ec2InstanceStats() {
        return privateIPsByInstanceId.stats();
    }

    public long containerInstanceCount() {
        return instanceIdsByContainerInstance.size();
    }

    public long ec2InstanceCount() {
        return privateIPsByInstanceId.size();
    }

    private Set<String> lookup(Cache<String, String> cache, Collection<String> keys, Map<String, String> found) {
        Set<String> missing = new LinkedHashSet<>();
        for (String key : keys) {
            String value = cache.getIfPresent(key);
            if (value != null) {
                found.put(key, value);
            } else {
                missing.add(key);
            }
        }
        return missing;
    }
}
