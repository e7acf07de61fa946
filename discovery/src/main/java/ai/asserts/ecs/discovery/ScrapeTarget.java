/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.discovery;

import ai.asserts.ecs.model.ScrapeInterval;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ScrapeTarget {
    private final String host;
    private final int port;
    private final String metricsPath;
    private final ScrapeInterval interval;
    /**
     * Name of the output bucket, assigned when the endpoint specification was parsed.
     */
    private final String bucket;
    private final Labels labels;
    private final String clusterArn;
    private final String taskArn;
    private final String containerName;

    public String getAddress() {
        return host + ":" + port;
    }
}
