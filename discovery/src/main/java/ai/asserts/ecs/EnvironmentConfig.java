/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.stream.Stream;

/**
 * Process level switches. With discovery turned off the process still serves the actuator endpoints but neither
 * calls AWS nor writes target files.
 */
@Component
public class EnvironmentConfig {
    private final boolean enabled;

    public EnvironmentConfig(@Value("${ecs_sd.enabled:true}") String enabled) {
        this.enabled = isEnabled(enabled);
    }

    public boolean isDisabled() {
        return !enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public static boolean isEnabled(String flag) {
        return flag != null && Stream.of("y", "yes", "true").anyMatch(value -> value.equalsIgnoreCase(flag.trim()));
    }
}
