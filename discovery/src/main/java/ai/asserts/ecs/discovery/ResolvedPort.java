/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.inventory.NetworkMode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ResolvedPort {
    private final String host;
    private final int port;
    private final NetworkMode networkMode;

    public String getAddress() {
        return host + ":" + port;
    }
}
