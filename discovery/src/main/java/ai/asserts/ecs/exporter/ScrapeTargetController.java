/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.exporter;

import ai.asserts.ecs.DiscoveryTaskManager;
import ai.asserts.ecs.discovery.DiscoveryResult;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.MediaType.APPLICATION_JSON_VALUE;
import static org.springframework.web.bind.annotation.RequestMethod.GET;

/**
 * Serves the targets of the latest discovery cycle in the Prometheus <code>http_sd</code> format.
 */
@RestController
@AllArgsConstructor
@Slf4j
public class ScrapeTargetController {
    private final DiscoveryTaskManager discoveryTaskManager;

    @RequestMapping(
            path = "/ecs-sd",
            produces = {APPLICATION_JSON_VALUE},
            method = GET)
    public ResponseEntity<Map<String, List<StaticConfig>>> getAllBuckets() {
        Map<String, List<StaticConfig>> buckets = new LinkedHashMap<>();
        discoveryTaskManager.getLatestResult().getBuckets()
                .forEach((bucket, targets) -> buckets.put(bucket, StaticConfig.from(targets)));
        return ResponseEntity.ok(buckets);
    }

    @RequestMapping(
            path = "/ecs-sd/{bucket}",
            produces = {APPLICATION_JSON_VALUE},
            method = GET)
    public ResponseEntity<List<StaticConfig>> getBucket(@PathVariable("bucket") String bucket) {
        DiscoveryResult result = discoveryTaskManager.getLatestResult();
        if (!result.getBuckets().containsKey(bucket)) {
            log.debug("Unknown bucket {}", bucket);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(StaticConfig.from(result.getTargets(bucket)));
    }
}
