/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import lombok.Getter;

@Getter
public class PortResolutionException extends Exception {
    private final FailureReason reason;

    public PortResolutionException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
