/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Output of one discovery cycle. All targets were computed from the same inventory snapshot.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class DiscoveryResult {
    private final Instant snapshotTime;
    @Builder.Default
    private final Map<String, List<ScrapeTarget>> buckets = new LinkedHashMap<>();
    @Builder.Default
    private final List<ResolutionFailure> failures = new ArrayList<>();

    public List<ScrapeTarget> getTargets(String bucket) {
        return buckets.getOrDefault(bucket, Collections.emptyList());
    }

    public List<ScrapeTarget> getAllTargets() {
        return buckets.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    public int getTargetCount() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }
}
