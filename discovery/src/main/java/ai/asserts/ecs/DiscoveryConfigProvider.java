/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import ai.asserts.ecs.config.DiscoveryConfig;

public interface DiscoveryConfigProvider {
    DiscoveryConfig getDiscoveryConfig();

    void update();
}
