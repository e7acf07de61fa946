/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.discovery.TaskDefinitionCache;
import ai.asserts.ecs.inventory.EcsInstanceCache;
import ai.asserts.ecs.inventory.EcsTaskDefinitionLoader;
import com.google.common.base.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@SuppressWarnings("unused")
public class BeanConfiguration {
    @Bean
    public AWSApiCallRateLimiter awsApiCallRateLimiter(MeterRegistry meterRegistry,
                                                       @Value("${ecs_sd.aws_api_calls_rate_limit:5}")
                                                       double rateLimit) {
        return new AWSApiCallRateLimiter(meterRegistry, rateLimit);
    }

    @Bean
    public TaskDefinitionCache taskDefinitionCache(EcsTaskDefinitionLoader taskDefinitionLoader,
                                                   DiscoveryConfigProvider discoveryConfigProvider) {
        DiscoveryConfig discoveryConfig = discoveryConfigProvider.getDiscoveryConfig();
        return new TaskDefinitionCache(taskDefinitionLoader,
                discoveryConfig.getTaskDefinitionCacheSize(),
                discoveryConfig.getTaskDefinitionCacheExpiry(),
                Ticker.systemTicker());
    }

    @Bean
    public EcsInstanceCache ecsInstanceCache(@Value("${ecs_sd.instance_cache_expiry_minutes:5}") long expiryMinutes) {
        return new EcsInstanceCache(Duration.ofMinutes(expiryMinutes), Ticker.systemTicker());
    }
}
