/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Task definitions are immutable once registered. A revision gets a new ARN, so a definition can be cached by ARN
 * for the lifetime of the process.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EcsTaskDefinition {
    private final String arn;
    private final String family;
    private final Integer revision;
    private final NetworkMode networkMode;
    @Builder.Default
    private final List<EcsContainerDefinition> containerDefinitions = new ArrayList<>();
    @Builder.Default
    private final Map<String, String> tags = new LinkedHashMap<>();
}
