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
import java.util.Optional;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EcsContainerDefinition {
    private final String name;
    @Builder.Default
    private final List<EcsPortMapping> portMappings = new ArrayList<>();
    @Builder.Default
    private final Map<String, String> environment = new LinkedHashMap<>();

    public Optional<String> getEnvironmentVariable(String name) {
        return Optional.ofNullable(environment.get(name));
    }
}
