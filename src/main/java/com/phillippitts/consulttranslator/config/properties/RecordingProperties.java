package com.phillippitts.consulttranslator.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for saving finished conversations.
 */
@Validated
@ConfigurationProperties(prefix = "translator.recording")
public class RecordingProperties {

    /** Save conversations when their session ends. */
    private final boolean enabled;

    /** Directory receiving the JSON files; created on first save. */
    @NotBlank
    private final String directory;

    /** File name prefix shared by the three files of a conversation. */
    @NotBlank
    private final String filePrefix;

    @ConstructorBinding
    public RecordingProperties(Boolean enabled, String directory, String filePrefix) {
        this.enabled = enabled == null || enabled;
        this.directory = directory == null ? "recordings" : directory;
        this.filePrefix = filePrefix == null ? "Doc-patient" : filePrefix;
        if (this.filePrefix.contains("/") || this.filePrefix.contains("\\")) {
            throw new IllegalArgumentException("translator.recording.file-prefix must not contain path separators");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getDirectory() {
        return directory;
    }

    public String getFilePrefix() {
        return filePrefix;
    }
}
