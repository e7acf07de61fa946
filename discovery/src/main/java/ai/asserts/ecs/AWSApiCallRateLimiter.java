/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import com.google.common.util.concurrent.RateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Throttles AWS API calls per region and operation, and records their latency and errors.
 */
@Slf4j
@SuppressWarnings("UnstableApiUsage")
public class AWSApiCallRateLimiter {
    public static final String OPERATION_LABEL = "operation";
    public static final String REGION_LABEL = "region";
    public static final String ERROR_TYPE_LABEL = "error_type";
    public static final String API_LATENCY_METRIC = "ecs_sd_aws_api_latency";
    public static final String API_ERROR_COUNT_METRIC = "ecs_sd_aws_api_errors";

    private final MeterRegistry meterRegistry;
    private final double defaultRateLimit;
    private final Map<String, RateLimiter> rateLimiters = new ConcurrentHashMap<>();

    public AWSApiCallRateLimiter(MeterRegistry meterRegistry, double defaultRateLimit) {
        this.meterRegistry = meterRegistry;
        this.defaultRateLimit = defaultRateLimit;
    }

    public <K extends AWSAPICall<V>, V> V doWithRateLimit(String api, SortedMap<String, String> labels, K k) {
        String fullKey = labels.getOrDefault(REGION_LABEL, "default") + "/" + api;
        RateLimiter rateLimiter = rateLimiters.computeIfAbsent(fullKey, s -> RateLimiter.create(defaultRateLimit));
        long tick = System.currentTimeMillis();
        try {
            double waitTime = rateLimiter.acquire();
            if (waitTime > 0.5) {
                log.warn("Operation {} throttled for {} seconds", fullKey, waitTime);
            }
            tick = System.currentTimeMillis();
            return k.makeCall();
        } catch (Throwable e) {
            log.error("Exception in: " + fullKey, e);
            List<Tag> errorTags = toTags(labels);
            errorTags.add(Tag.of(ERROR_TYPE_LABEL, e.getClass().getSimpleName()));
            Counter.builder(API_ERROR_COUNT_METRIC)
                    .tags(errorTags)
                    .register(meterRegistry)
                    .increment();
            throw new RuntimeException(e);
        } finally {
            tick = System.currentTimeMillis() - tick;
            Timer.builder(API_LATENCY_METRIC)
                    .tags(toTags(labels))
                    .register(meterRegistry)
                    .record(tick, TimeUnit.MILLISECONDS);
        }
    }

    private List<Tag> toTags(SortedMap<String, String> labels) {
        List<Tag> tags = new ArrayList<>();
        labels.forEach((key, value) -> tags.add(Tag.of(key, value != null ? value : "")));
        return tags;
    }

    public interface AWSAPICall<V> {
        V makeCall();
    }
}
