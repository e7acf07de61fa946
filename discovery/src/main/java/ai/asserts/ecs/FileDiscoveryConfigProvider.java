/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs;

import ai.asserts.ecs.config.DiscoveryConfig;
import ai.asserts.ecs.config.TagExportConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads the discovery configuration from a YAML file and applies the environment overrides on top. A missing file
 * means the defaults. A file that cannot be read or fails validation is logged and replaced with the defaults.
 */
@Component
@Slf4j
public class FileDiscoveryConfigProvider implements DiscoveryConfigProvider {
    public static final String DEFAULT_SCRAPE_INTERVAL = "DEFAULT_SCRAPE_INTERVAL";
    public static final String DEFAULT_SCRAPE_INTERVAL_BUCKET = "DEFAULT_SCRAPE_INTERVAL_BUCKET";
    public static final String TAGS_TO_LABELS = "TAGS_TO_LABELS";
    public static final String ECS_CLUSTERS = "ECS_CLUSTERS";

    private final ObjectMapperFactory objectMapperFactory;
    private final String configFile;
    private final ReadWriteLock readWriteLock = new ReentrantReadWriteLock();
    private final ResourceLoader resourceLoader = new FileSystemResourceLoader();
    private volatile DiscoveryConfig configCache;

    public FileDiscoveryConfigProvider(ObjectMapperFactory objectMapperFactory,
                                       @Value("${ecs_sd.config.file:ecs_sd_config.yml}") String configFile) {
        this.objectMapperFactory = objectMapperFactory;
        this.configFile = configFile;
    }

    @Override
    public DiscoveryConfig getDiscoveryConfig() {
        DiscoveryConfig config = readConfig();
        if (config == null) {
            update();
            config = readConfig();
        }
        return config;
    }

    @Override
    public void update() {
        readWriteLock.writeLock().lock();
        try {
            configCache = load();
        } finally {
            readWriteLock.writeLock().unlock();
        }
    }

    private DiscoveryConfig readConfig() {
        try {
            readWriteLock.readLock().lock();
            return configCache;
        } finally {
            readWriteLock.readLock().unlock();
        }
    }

    @VisibleForTesting
    DiscoveryConfig load() {
        DiscoveryConfig discoveryConfig = new DiscoveryConfig();
        ObjectMapper objectMapper = objectMapperFactory.getObjectMapper();
        try {
            Resource resource = resourceLoader.getResource(configFile);
            if (resource.exists()) {
                log.info("Will load configuration from {}", configFile);
                discoveryConfig = objectMapper.readValue(resource.getURL(), new TypeReference<DiscoveryConfig>() {
                });
            } else {
                log.info("{} not found. Will use the default configuration", configFile);
            }
            applyOverrides(discoveryConfig, getGetenv());
            discoveryConfig.validateConfig();
            if (discoveryConfig.isLogConfig()) {
                log.info("Loaded configuration \n{}\n", objectMapper
                        .writerWithDefaultPrettyPrinter()
                        .writeValueAsString(discoveryConfig));
            }
            return discoveryConfig;
        } catch (IOException e) {
            log.error("Failed to load discovery configuration from file " + configFile, e);
            return defaultConfig();
        } catch (Exception e) {
            log.error("Failed to load discovery configuration", e);
            return defaultConfig();
        }
    }

    @VisibleForTesting
    void applyOverrides(DiscoveryConfig discoveryConfig, Map<String, String> envVariables) {
        if (envVariables.containsKey(DEFAULT_SCRAPE_INTERVAL)) {
            discoveryConfig.setDefaultScrapeInterval(envVariables.get(DEFAULT_SCRAPE_INTERVAL).trim());
        }
        if (envVariables.containsKey(DEFAULT_SCRAPE_INTERVAL_BUCKET)) {
            discoveryConfig.setDefaultIntervalBucket(envVariables.get(DEFAULT_SCRAPE_INTERVAL_BUCKET).trim());
        }
        if (envVariables.containsKey(TAGS_TO_LABELS)) {
            if (discoveryConfig.getTagExportConfig() == null) {
                discoveryConfig.setTagExportConfig(new TagExportConfig());
            }
            discoveryConfig.getTagExportConfig().setIncludeTags(split(envVariables.get(TAGS_TO_LABELS)));
        }
        if (envVariables.containsKey(ECS_CLUSTERS)) {
            discoveryConfig.setClusters(split(envVariables.get(ECS_CLUSTERS)));
        }
    }

    private DiscoveryConfig defaultConfig() {
        DiscoveryConfig discoveryConfig = new DiscoveryConfig();
        discoveryConfig.validateConfig();
        return discoveryConfig;
    }

    private Set<String> split(String value) {
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @VisibleForTesting
    Map<String, String> getGetenv() {
        return System.getenv();
    }
}
