package com.phillippitts.consulttranslator.exception;

/**
 * Thrown when a finished conversation cannot be written to, or read from, the recordings directory.
 */
public class RecordingException extends TranslatorException {

    private final String path;

    public RecordingException(String message, String path) {
        super(message + ": " + path);
        this.path = path;
    }

    public RecordingException(String message, String path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
