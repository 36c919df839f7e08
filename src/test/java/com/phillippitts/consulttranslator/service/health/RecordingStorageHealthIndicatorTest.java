package com.phillippitts.consulttranslator.service.health;

import com.phillippitts.consulttranslator.config.properties.RecordingProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingStorageHealthIndicatorTest {

    @TempDir
    Path tempDir;

    private static Health health(boolean enabled, Path directory) {
        return new RecordingStorageHealthIndicator(
                new RecordingProperties(enabled, directory.toString(), "Doc-patient")).health();
    }

    @Test
    void shouldReportUpWhenRecordingDisabled() {
        Health health = health(false, tempDir.resolve("anything"));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("recording", "disabled");
    }

    @Test
    void shouldReportUpForWritableDirectory() {
        Health health = health(true, tempDir);

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("directory")).asString().contains("writable at");
    }

    @Test
    void shouldReportUpWhenDirectoryCanBeCreated() {
        Health health = health(true, tempDir.resolve("new/nested"));

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("directory")).asString().contains("will be created at");
    }

    @Test
    void shouldReportDownWhenPathIsAFile() throws IOException {
        Path file = Files.createFile(tempDir.resolve("recordings"));

        Health health = health(true, file);

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("directory")).asString().contains("NOT A DIRECTORY at");
    }
}
