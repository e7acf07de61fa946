/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.model.ScrapeInterval;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.springframework.util.StringUtils.hasText;

/**
 * Parses the <code>PROMETHEUS_ENDPOINT</code> specification, a comma separated list of
 * <code>[interval:]path</code> entries. For example
 * <ul>
 *     <li><code>5m:/mymetrics,30s:/mymetrics2</code></li>
 *     <li><code>/mymetrics</code></li>
 *     <li><code>30s:/mymetrics1,/mymetrics2</code></li>
 * </ul>
 * Malformed entries are skipped. A specification without any usable entry scrapes <code>/metrics</code> at the
 * default interval.
 */
@Slf4j
@Getter
public class EndpointSpecParser {
    public static final String DEFAULT_METRICS_PATH = "/metrics";
    public static final String ENTRY_SEPARATOR = ",";
    public static final char INTERVAL_SEPARATOR = ':';

    private final ScrapeInterval defaultInterval;
    private final String defaultBucket;

    public EndpointSpecParser(ScrapeInterval defaultInterval, String defaultBucket) {
        this.defaultInterval = defaultInterval;
        this.defaultBucket = defaultBucket;
    }

    public static EndpointSpecParser from(DiscoveryConfig discoveryConfig) {
        return new EndpointSpecParser(discoveryConfig.getDefaultInterval(), discoveryConfig.getDefaultBucketName());
    }

    public List<ScrapeEndpoint> parse(String spec) {
        if (!hasText(spec)) {
            return defaultEndpoints();
        }

        List<ScrapeEndpoint> endpoints = new ArrayList<>();
        for (String entry : spec.split(ENTRY_SEPARATOR, -1)) {
            Optional<ScrapeEndpoint> endpoint = parseEntry(entry.trim());
            if (endpoint.isPresent()) {
                endpoints.add(endpoint.get());
            } else {
                log.warn("Skipping malformed entry [{}] in endpoint spec [{}]", entry, spec);
            }
        }

        if (endpoints.isEmpty()) {
            log.warn("No valid entry in endpoint spec [{}]. Will scrape {} every {}", spec, DEFAULT_METRICS_PATH,
                    defaultInterval.getToken());
            return defaultEndpoints();
        }
        return endpoints;
    }

    /**
     * Renders endpoints in the canonical specification form. Entries in the default bucket are rendered without an
     * interval so that they land in the default bucket again when parsed.
     */
    public String format(List<ScrapeEndpoint> endpoints) {
        return endpoints.stream()
                .map(endpoint -> endpoint.isExplicitInterval() ?
                        endpoint.getInterval().getToken() + INTERVAL_SEPARATOR + endpoint.getPath() :
                        endpoint.getPath())
                .collect(Collectors.joining(ENTRY_SEPARATOR));
    }

    @VisibleForTesting
    Optional<ScrapeEndpoint> parseEntry(String entry) {
        if (entry.isEmpty()) {
            return Optional.empty();
        }

        // A path may itself contain ':', so only a prefix before the first '/' can name an interval
        if (entry.startsWith("/")) {
            return Optional.of(defaultEndpoint(entry));
        }

        int separator = entry.indexOf(INTERVAL_SEPARATOR);
        if (separator < 0) {
            return Optional.empty();
        }
        String path = entry.substring(separator + 1).trim();
        if (!isValidPath(path)) {
            return Optional.empty();
        }
        return ScrapeInterval.fromToken(entry.substring(0, separator))
                .map(interval -> ScrapeEndpoint.builder()
                        .interval(interval)
                        .path(path)
                        .bucket(interval.getToken())
                        .explicitInterval(true)
                        .build());
    }

    private boolean isValidPath(String path) {
        return path.startsWith("/");
    }

    private List<ScrapeEndpoint> defaultEndpoints() {
        return ImmutableList.of(defaultEndpoint(DEFAULT_METRICS_PATH));
    }

    private ScrapeEndpoint defaultEndpoint(String path) {
        return ScrapeEndpoint.builder()
                .interval(defaultInterval)
                .path(path)
                .bucket(defaultBucket)
                .explicitInterval(false)
                .build();
    }
}
