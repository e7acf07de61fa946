/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.config;

import ai.asserts.ecs.model.ScrapeInterval;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiscoveryConfigTest {
    @Test
    public void defaults() {
        DiscoveryConfig discoveryConfig = new DiscoveryConfig();
        assertEquals("1m", discoveryConfig.getDefaultScrapeInterval());
        assertEquals(ScrapeInterval.ONE_MINUTE, discoveryConfig.getDefaultInterval());
        assertEquals("default", discoveryConfig.getDefaultBucketName());
        assertEquals(1000, discoveryConfig.getTaskDefinitionCacheSize());
        assertNull(discoveryConfig.getTaskDefinitionCacheExpiry());
        assertFalse(discoveryConfig.shouldExportTag("team"));
        discoveryConfig.validateConfig();
    }

    @Test
    public void defaultBucketName() {
        DiscoveryConfig discoveryConfig = DiscoveryConfig.builder()
                .defaultScrapeInterval("30s")
                .build();
        assertEquals("default", discoveryConfig.getDefaultBucketName());

        discoveryConfig.setDefaultIntervalBucket("slow");
        assertEquals("slow", discoveryConfig.getDefaultBucketName());

        discoveryConfig.setDefaultIntervalBucket(null);
        assertEquals("default", discoveryConfig.getDefaultBucketName());
        assertEquals(ScrapeInterval.THIRTY_SECONDS, discoveryConfig.getDefaultInterval());
    }

    @Test
    public void shouldDiscoverCluster() {
        DiscoveryConfig discoveryConfig = new DiscoveryConfig();
        assertTrue(discoveryConfig.shouldDiscoverCluster("any", "arn:aws:ecs:us-west-2:123:cluster/any"));

        discoveryConfig.setClusters(ImmutableSet.of("prod", "arn:aws:ecs:us-west-2:123:cluster/staging"));
        assertTrue(discoveryConfig.shouldDiscoverCluster("prod", "arn:aws:ecs:us-west-2:123:cluster/prod"));
        assertTrue(discoveryConfig.shouldDiscoverCluster("staging", "arn:aws:ecs:us-west-2:123:cluster/staging"));
        assertFalse(discoveryConfig.shouldDiscoverCluster("dev", "arn:aws:ecs:us-west-2:123:cluster/dev"));
    }

    @Test
    public void cacheExpiry() {
        DiscoveryConfig discoveryConfig = DiscoveryConfig.builder()
                .taskDefinitionCacheExpiryMinutes(30)
                .build();
        assertEquals(Duration.ofMinutes(30), discoveryConfig.getTaskDefinitionCacheExpiry());
    }

    @Test
    public void validateConfig_invalidInterval() {
        DiscoveryConfig discoveryConfig = DiscoveryConfig.builder()
                .defaultScrapeInterval("10s")
                .build();
        assertThrows(RuntimeException.class, discoveryConfig::validateConfig);
    }

    @Test
    public void validateConfig_invalidBucket() {
        DiscoveryConfig discoveryConfig = DiscoveryConfig.builder()
                .defaultIntervalBucket("../etc")
                .build();
        assertThrows(RuntimeException.class, discoveryConfig::validateConfig);
    }

    @Test
    public void validateConfig_bucketCollidesWithInterval() {
        for (ScrapeInterval interval : ScrapeInterval.values()) {
            DiscoveryConfig discoveryConfig = DiscoveryConfig.builder()
                    .defaultIntervalBucket(interval.getToken())
                    .build();
            assertThrows(RuntimeException.class, discoveryConfig::validateConfig, interval.getToken());
        }
    }

    @Test
    public void validateConfig_compilesTagPatterns() {
        TagExportConfig tagExportConfig = new TagExportConfig();
        tagExportConfig.setIncludePatterns(ImmutableSet.of("team.*"));
        DiscoveryConfig discoveryConfig = DiscoveryConfig.builder()
                .tagExportConfig(tagExportConfig)
                .build();
        discoveryConfig.validateConfig();
        assertTrue(discoveryConfig.shouldExportTag("team_name"));
    }
}
