/*
 *  Copyright © 2020.
 *  Asserts, Inc. - All Rights Reserved
 */
package ai.asserts.ecs.exporter;

import ai.asserts.ecs.ObjectMapperFactory;
import ai.asserts.ecs.discovery.DiscoveryResult;
import ai.asserts.ecs.discovery.ScrapeTarget;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.common.annotations.VisibleForTesting;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Writes one <code>&lt;bucket&gt;-tasks.json</code> file per bucket. Each file is written to a temporary file in the
 * same directory and then renamed over the previous one, so Prometheus never reads a partially written file.
 */
@Component
@Slf4j
public class ScrapeTargetFileWriter {
    public static final String FILE_SUFFIX = "-tasks.json";
    public static final String TEMP_SUFFIX = ".tmp";

    private final ObjectMapperFactory objectMapperFactory;
    @Getter
    private final Path directory;

    public ScrapeTargetFileWriter(ObjectMapperFactory objectMapperFactory,
                                  @Value("${ecs_sd.directory:/prometheus/ecs}") String directory) {
        this.objectMapperFactory = objectMapperFactory;
        this.directory = Paths.get(directory);
    }

    /**
     * @return names of the buckets whose file could not be written.
     */
    public Set<String> write(DiscoveryResult result, boolean logTargets) {
        Set<String> failed = new TreeSet<>();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            log.error("Failed to create directory " + directory, e);
            failed.addAll(result.getBuckets().keySet());
            return failed;
        }

        for (Map.Entry<String, List<ScrapeTarget>> bucket : result.getBuckets().entrySet()) {
            try {
                writeFile(getFile(bucket.getKey()), StaticConfig.from(bucket.getValue()), logTargets);
            } catch (IOException e) {
                log.error("Failed to write targets of bucket " + bucket.getKey(), e);
                failed.add(bucket.getKey());
            }
        }
        return failed;
    }

    public Path getFile(String bucket) {
        return directory.resolve(bucket + FILE_SUFFIX);
    }

    @VisibleForTesting
    void writeFile(Path file, List<StaticConfig> targets, boolean logTargets) throws IOException {
        ObjectWriter objectWriter = objectMapperFactory.getJsonMapper().writerWithDefaultPrettyPrinter();
        Path tempFile = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        objectWriter.writeValue(tempFile.toFile(), targets);
        try {
            Files.move(tempFile, file, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}", file);
            Files.move(tempFile, file, REPLACE_EXISTING);
        }
        if (logTargets) {
            log.info("Wrote {} targets to {}\n{}\n", targets.size(), file.toUri(),
                    objectWriter.writeValueAsString(targets));
        } else {
            log.info("Wrote {} targets to {}", targets.size(), file.toUri());
        }
    }
}
