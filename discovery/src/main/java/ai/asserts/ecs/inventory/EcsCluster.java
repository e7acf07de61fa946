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
import java.util.List;
import java.util.Optional;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EcsCluster {
    private final String arn;
    private final String name;
    @Builder.Default
    private final List<EcsService> services = new ArrayList<>();
    @Builder.Default
    private final List<EcsTask> tasks = new ArrayList<>();

    public Optional<EcsService> getService(String serviceName) {
        if (serviceName == null) {
            return Optional.empty();
        }
        return services.stream()
                .filter(service -> serviceName.equals(service.getName()))
                .findFirst();
    }
}
