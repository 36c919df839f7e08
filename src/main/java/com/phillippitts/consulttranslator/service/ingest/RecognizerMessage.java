package com.phillippitts.consulttranslator.service.ingest;

import com.phillippitts.consulttranslator.domain.Token;

import java.util.List;

/**
 * One parsed result message from the streaming recognizer.
 *
 * @param tokens       tokens in message order (empty for heartbeats and errors)
 * @param errorCode    recognizer error code, or null
 * @param errorMessage recognizer error description, or null
 * @param finished     {@code true} when the recognizer signalled the end of the stream
 */
public record RecognizerMessage(List<Token> tokens, String errorCode, String errorMessage, boolean finished) {

    private static final RecognizerMessage EMPTY = new RecognizerMessage(List.of(), null, null, false);

    public RecognizerMessage {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static RecognizerMessage empty() {
        return EMPTY;
    }

    public static RecognizerMessage error(String errorCode, String errorMessage) {
        return new RecognizerMessage(List.of(), errorCode, errorMessage, false);
    }

    public boolean isError() {
        return errorCode != null;
    }
}
