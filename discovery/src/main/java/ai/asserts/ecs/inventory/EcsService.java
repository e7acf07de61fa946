/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class EcsService {
    private final String arn;
    private final String name;
    private final String clusterArn;
    @Builder.Default
    private final Map<String, String> tags = new LinkedHashMap<>();
}
