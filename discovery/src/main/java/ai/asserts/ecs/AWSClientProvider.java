/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.Ec2ClientBuilder;
import software.amazon.awssdk.services.ecs.EcsClient;
import software.amazon.awssdk.services.ecs.EcsClientBuilder;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import static java.util.concurrent.TimeUnit.MINUTES;
import static org.springframework.util.StringUtils.hasText;

/**
 * SDK clients for the configured region. Without a configured region the SDK's default region provider chain
 * applies. Clients that have not been used for a while are closed.
 */
@Component
@Slf4j
public class AWSClientProvider {
    private final String region;
    private final Cache<ClientCacheKey, SdkClient> clientCache;

    public AWSClientProvider(@Value("${ecs_sd.region:}") String region,
                             @Value("${ecs_sd.client_cache_ttl_minutes:30}") long clientCacheTTL) {
        this.region = region;
        this.clientCache = CacheBuilder.newBuilder()
                .expireAfterAccess(clientCacheTTL, MINUTES)
                .removalListener(removalNotification -> {
                    try {
                        SdkClient sdkClient = (SdkClient) removalNotification.getValue();
                        log.info("Shutting down SDK Client {}", sdkClient.serviceName());
                        sdkClient.close();
                    } catch (Exception e) {
                        log.error("Failed to close client", e);
                    }
                })
                .build();
    }

    public String getRegion() {
        return hasText(region) ? region : "default";
    }

    public EcsClient getEcsClient() {
        return (EcsClient) getClient(EcsClient.class, () -> {
            EcsClientBuilder builder = EcsClient.builder();
            if (hasText(region)) {
                builder = builder.region(Region.of(region));
            }
            return builder.build();
        });
    }

    public Ec2Client getEc2Client() {
        return (Ec2Client) getClient(Ec2Client.class, () -> {
            Ec2ClientBuilder builder = Ec2Client.builder();
            if (hasText(region)) {
                builder = builder.region(Region.of(region));
            }
            return builder.build();
        });
    }

    private SdkClient getClient(Class<?> clientType, Callable<SdkClient> factory) {
        try {
            return clientCache.get(new ClientCacheKey(getRegion(), clientType), factory);
        } catch (ExecutionException e) {
            throw new RuntimeException(e.getCause());
        }
    }

    @EqualsAndHashCode
    @Getter
    @AllArgsConstructor
    public static class ClientCacheKey {
        private final String region;
        private final Class<?> clientType;
    }
}
