/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

public enum FailureReason {
    INVALID_PORT_OVERRIDE,
    NO_ADDRESS,
    NO_DECLARED_PORT,
    NO_NETWORK_BINDINGS,
    NO_MATCHING_BINDING,
    UNSUPPORTED_NETWORK_MODE,
    TASK_DEFINITION_UNAVAILABLE
}
