/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Getter;

import java.util.stream.Stream;

@Getter
public enum LaunchType {
    EC2("EC2"),
    FARGATE("FARGATE"),
    EXTERNAL("EXTERNAL");

    private final String value;

    LaunchType(String value) {
        this.value = value;
    }

    /**
     * Tasks that do not report a launch type were placed by a capacity provider on container instances.
     */
    public static LaunchType fromValue(String value) {
        if (value == null) {
            return EC2;
        }
        return Stream.of(values())
                .filter(type -> type.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(EC2);
    }

    public boolean isServerless() {
        return this == FARGATE;
    }
}
