package com.phillippitts.consulttranslator.exception;

/**
 * Thrown when a requested recording file does not exist.
 */
public class RecordingNotFoundException extends TranslatorException {

    private final String fileName;

    public RecordingNotFoundException(String fileName) {
        super("Recording not found: " + fileName);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
