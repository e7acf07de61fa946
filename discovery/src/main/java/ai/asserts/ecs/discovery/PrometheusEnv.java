/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

/**
 * Container definition environment variables that control discovery.
 */
public final class PrometheusEnv {
    public static final String PROMETHEUS = "PROMETHEUS";
    public static final String PROMETHEUS_ENDPOINT = "PROMETHEUS_ENDPOINT";
    public static final String PROMETHEUS_PORT = "PROMETHEUS_PORT";
    public static final String PROMETHEUS_CONTAINER_PORT = "PROMETHEUS_CONTAINER_PORT";
    public static final String PROMETHEUS_NOLABELS = "PROMETHEUS_NOLABELS";

    private PrometheusEnv() {
    }

    public static boolean isTrue(String value) {
        return value != null && "true".equalsIgnoreCase(value.trim());
    }
}
