/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything one discovery cycle knows about the ECS inventory. Task definitions are not part of the snapshot, they
 * are resolved by ARN through the task definition cache.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class InventorySnapshot {
    @Builder.Default
    private final Instant takenAt = Instant.now();
    @Builder.Default
    private final List<EcsCluster> clusters = new ArrayList<>();

    public static InventorySnapshot empty() {
        return InventorySnapshot.builder().build();
    }

    public int getTaskCount() {
        return clusters.stream().mapToInt(cluster -> cluster.getTasks().size()).sum();
    }
}
