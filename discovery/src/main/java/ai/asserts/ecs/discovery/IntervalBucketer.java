/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.model.ScrapeInterval;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Groups targets into one bucket per scrape interval plus the default bucket. Every bucket is present in the result,
 * even when empty, so that a bucket whose last target went away gets an empty target file.
 */
@Component
public class IntervalBucketer {
    public Set<String> getBucketNames(String defaultBucket) {
        Set<String> names = new LinkedHashSet<>();
        Stream.of(ScrapeInterval.values()).map(ScrapeInterval::getToken).forEach(names::add);
        names.add(defaultBucket);
        return names;
    }

    public Map<String, List<ScrapeTarget>> bucket(List<ScrapeTarget> targets, String defaultBucket) {
        Map<String, List<ScrapeTarget>> buckets = new LinkedHashMap<>();
        getBucketNames(defaultBucket).forEach(name -> buckets.put(name, new ArrayList<>()));
        targets.forEach(target -> buckets.computeIfAbsent(target.getBucket(), k -> new ArrayList<>()).add(target));
        return buckets;
    }
}
