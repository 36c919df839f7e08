package com.phillippitts.consulttranslator.service.health;

import com.phillippitts.consulttranslator.config.properties.RecordingProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Health indicator for the conversation recordings directory.
 *
 * <ul>
 *   <li>UP: recording disabled, or the directory is writable (or can be created)</li>
 *   <li>DOWN: finished conversations could not be saved</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RecordingStorageHealthIndicator implements HealthIndicator {

    private final RecordingProperties props;

    public RecordingStorageHealthIndicator(RecordingProperties props) {
        this.props = props;
    }

    @Override
    public Health health() {
        if (!props.isEnabled()) {
            return Health.up().withDetail("recording", "disabled").build();
        }
        Path directory = Paths.get(props.getDirectory()).toAbsolutePath();
        if (Files.isDirectory(directory)) {
            return Files.isWritable(directory)
                    ? Health.up().withDetail("directory", "writable at " + directory).build()
                    : Health.down().withDetail("directory", "NOT WRITABLE at " + directory).build();
        }
        if (Files.exists(directory)) {
            return Health.down().withDetail("directory", "NOT A DIRECTORY at " + directory).build();
        }
        // Created on first save
        Path parent = existingAncestor(directory);
        if (parent != null && Files.isWritable(parent)) {
            return Health.up().withDetail("directory", "will be created at " + directory).build();
        }
        return Health.down().withDetail("directory", "CANNOT CREATE at " + directory).build();
    }

    private static Path existingAncestor(Path path) {
        Path current = path.getParent();
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current;
    }
}
