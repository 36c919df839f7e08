package com.phillippitts.consulttranslator.exception;

/**
 * Base exception for all consult translator errors.
 * Domain exceptions extend this class so the web layer can handle them in one place.
 */
public class TranslatorException extends RuntimeException {

    public TranslatorException(String message) {
        super(message);
    }

    public TranslatorException(String message, Throwable cause) {
        super(message, cause);
    }

    public TranslatorException(Throwable cause) {
        super(cause);
    }
}
