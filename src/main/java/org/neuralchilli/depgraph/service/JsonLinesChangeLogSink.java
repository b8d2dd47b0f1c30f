package org.neuralchilli.depgraph.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.depgraph.config.DependencyGraphConfig;
import org.neuralchilli.depgraph.config.TaskCollectionCodec;
import org.neuralchilli.depgraph.domain.ChangeLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON object per line to the configured change log file.
 */
@ApplicationScoped
public class JsonLinesChangeLogSink implements ChangeLogSink {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesChangeLogSink.class);

    @Inject
    DependencyGraphConfig config;

    @Inject
    TaskCollectionCodec codec;

    @Override
    public void record(ChangeLogEntry entry) {
        if (!config.changelog().enabled()) {
            return;
        }

        Path file = Path.of(config.changelog().file());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, codec.writeEntry(entry) + System.lineSeparator(),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.debug("Logged {} {} -> {} to {}", entry.action().wireValue(), entry.taskId(), entry.dependsOn(), file);
        } catch (IOException | RuntimeException e) {
            // the mutation already happened; losing its record must not undo it
            log.warn("Failed to write change log entry for {} -> {} to {}", entry.taskId(), entry.dependsOn(), file, e);
        }
    }
}
