/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.exporter;

import ai.asserts.ecs.discovery.Labels;
import ai.asserts.ecs.discovery.ScrapeTarget;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * One entry of a Prometheus <code>file_sd</code> / <code>http_sd</code> target list.
 */
@Builder
@Getter
@ToString
@EqualsAndHashCode
public class StaticConfig {
    @Builder.Default
    private final Set<String> targets = new TreeSet<>();
    private final Labels labels;

    public static StaticConfig from(ScrapeTarget target) {
        StaticConfig staticConfig = StaticConfig.builder()
                .labels(target.getLabels())
                .build();
        staticConfig.getTargets().add(target.getAddress());
        return staticConfig;
    }

    public static List<StaticConfig> from(List<ScrapeTarget> targets) {
        return targets.stream().map(StaticConfig::from).collect(Collectors.toList());
    }
}
