/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.config;

import ai.asserts.ecs.model.ScrapeInterval;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.springframework.util.CollectionUtils;

import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import static org.springframework.util.StringUtils.hasLength;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressWarnings("FieldMayBeFinal")
@EqualsAndHashCode
@ToString
public class DiscoveryConfig {
    public static final Pattern BUCKET_NAME_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");
    public static final String DEFAULT_BUCKET = "default";

    /**
     * Interval given to endpoint entries that do not name one.
     */
    @Builder.Default
    private String defaultScrapeInterval = ScrapeInterval.ONE_MINUTE.getToken();

    /**
     * Output bucket for endpoint entries that do not name an interval. It never shares a name with an interval
     * bucket, so <code>/a</code> and <code>1m:/b</code> land in different buckets even when the default interval
     * is <code>1m</code>.
     */
    @Builder.Default
    private String defaultIntervalBucket = DEFAULT_BUCKET;

    @Builder.Default
    private TagExportConfig tagExportConfig = new TagExportConfig();

    /**
     * Cluster names or ARNs to discover. Empty means every cluster visible to the credentials.
     */
    @Builder.Default
    private Set<String> clusters = new TreeSet<>();

    @Builder.Default
    private long taskDefinitionCacheSize = 1000;

    @Builder.Default
    private long taskDefinitionCacheExpiryMinutes = 0;

    @Builder.Default
    private boolean logTargets = false;

    @Builder.Default
    private boolean logConfig = false;

    @JsonIgnore
    public ScrapeInterval getDefaultInterval() {
        return ScrapeInterval.fromToken(defaultScrapeInterval).orElse(ScrapeInterval.ONE_MINUTE);
    }

    @JsonIgnore
    public String getDefaultBucketName() {
        return hasLength(defaultIntervalBucket) ? defaultIntervalBucket : DEFAULT_BUCKET;
    }

    @JsonIgnore
    public Duration getTaskDefinitionCacheExpiry() {
        return taskDefinitionCacheExpiryMinutes > 0 ? Duration.ofMinutes(taskDefinitionCacheExpiryMinutes) : null;
    }

    public boolean shouldDiscoverCluster(String clusterName, String clusterArn) {
        return CollectionUtils.isEmpty(clusters) || clusters.contains(clusterName) || clusters.contains(clusterArn);
    }

    public boolean shouldExportTag(String tagName) {
        if (tagExportConfig != null) {
            return tagExportConfig.shouldCaptureTag(tagName);
        }
        return false;
    }

    public void validateConfig() {
        if (!ScrapeInterval.isSupported(defaultScrapeInterval)) {
            throw new RuntimeException("Unsupported defaultScrapeInterval [" + defaultScrapeInterval + "]");
        }
        if (hasLength(defaultIntervalBucket) && !BUCKET_NAME_PATTERN.matcher(defaultIntervalBucket).matches()) {
            throw new RuntimeException("Invalid defaultIntervalBucket [" + defaultIntervalBucket + "]");
        }
        if (ScrapeInterval.isSupported(defaultIntervalBucket)) {
            throw new RuntimeException("defaultIntervalBucket [" + defaultIntervalBucket +
                    "] collides with the bucket of an explicit interval");
        }
        if (taskDefinitionCacheSize <= 0) {
            throw new RuntimeException("taskDefinitionCacheSize must be positive");
        }
        if (tagExportConfig != null) {
            tagExportConfig.compile();
        }
    }
}
