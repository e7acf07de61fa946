/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.exporter;

import ai.asserts.ecs.DiscoveryTaskManager;
import ai.asserts.ecs.discovery.DiscoveryResult;
import ai.asserts.ecs.discovery.IntervalBucketer;
import ai.asserts.ecs.discovery.Labels;
import ai.asserts.ecs.discovery.ScrapeTarget;
import com.google.common.collect.ImmutableList;
import org.easymock.EasyMockSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.easymock.EasyMock.expect;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ScrapeTargetControllerTest extends EasyMockSupport {
    private DiscoveryTaskManager discoveryTaskManager;
    private ScrapeTargetController testClass;
    private DiscoveryResult result;
    private Labels labels;

    @BeforeEach
    public void setup() {
        discoveryTaskManager = mock(DiscoveryTaskManager.class);
        testClass = new ScrapeTargetController(discoveryTaskManager);
        labels = Labels.builder().job("web").metricsPath("/metrics").build().populateMapEntries();
        ScrapeTarget target = ScrapeTarget.builder()
                .host("10.0.1.5")
                .port(9100)
                .bucket("1m")
                .labels(labels)
                .build();
        result = DiscoveryResult.builder()
                .buckets(new IntervalBucketer().bucket(ImmutableList.of(target), "default"))
                .build();
    }

    @Test
    public void getBucket() {
        expect(discoveryTaskManager.getLatestResult()).andReturn(result);
        replayAll();
        ResponseEntity<List<StaticConfig>> response = testClass.getBucket("1m");
        assertEquals(HttpStatus.OK, response.getStatusCode());
        StaticConfig expected = StaticConfig.builder().labels(labels).build();
        expected.getTargets().add("10.0.1.5:9100");
        assertEquals(ImmutableList.of(expected), response.getBody());
        verifyAll();
    }

    @Test
    public void getBucket_unknown() {
        expect(discoveryTaskManager.getLatestResult()).andReturn(result);
        replayAll();
        assertEquals(HttpStatus.NOT_FOUND, testClass.getBucket("10s").getStatusCode());
        verifyAll();
    }

    @Test
    public void getAllBuckets() {
        expect(discoveryTaskManager.getLatestResult()).andReturn(result);
        replayAll();
        Map<String, List<StaticConfig>> buckets = testClass.getAllBuckets().getBody();
        assertEquals(ImmutableList.of("15s", "30s", "1m", "5m", "default"), ImmutableList.copyOf(buckets.keySet()));
        assertEquals(1, buckets.get("1m").size());
        assertEquals(0, buckets.get("5m").size());
        verifyAll();
    }
}
