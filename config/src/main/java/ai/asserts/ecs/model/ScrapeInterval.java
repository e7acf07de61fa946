/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.model;

import lombok.Getter;

import java.time.Duration;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The scrape intervals a container can ask for in its <code>PROMETHEUS_ENDPOINT</code>. Each interval has its own
 * output bucket, named after the interval token.
 */
@Getter
public enum ScrapeInterval {
    FIFTEEN_SECONDS("15s", Duration.ofSeconds(15)),
    THIRTY_SECONDS("30s", Duration.ofSeconds(30)),
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5));

    private final String token;
    private final Duration duration;

    ScrapeInterval(String token, Duration duration) {
        this.token = token;
        this.duration = duration;
    }

    public static Optional<ScrapeInterval> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        return Stream.of(values())
                .filter(interval -> interval.token.equals(trimmed))
                .findFirst();
    }

    public static boolean isSupported(String token) {
        return fromToken(token).isPresent();
    }
}
