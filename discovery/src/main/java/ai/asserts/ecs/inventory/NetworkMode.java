/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.inventory;

import lombok.Getter;

import java.util.Optional;
import java.util.stream.Stream;

@Getter
public enum NetworkMode {
    BRIDGE("bridge"),
    HOST("host"),
    AWSVPC("awsvpc"),
    NONE("none");

    private final String value;

    NetworkMode(String value) {
        this.value = value;
    }

    public static Optional<NetworkMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Stream.of(values())
                .filter(mode -> mode.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
