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

/**
 * One <code>interval:path</code> entry of a <code>PROMETHEUS_ENDPOINT</code> specification. The bucket is fixed when
 * the entry is parsed: the interval token for explicit entries, the default bucket otherwise.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class ScrapeEndpoint {
    private final ScrapeInterval interval;
    private final String path;
    private final String bucket;
    private final boolean explicitInterval;
}
