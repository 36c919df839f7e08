package com.phillippitts.consulttranslator.service.events;

import java.time.Instant;

/**
 * Emitted when the upstream recognizer reports an error for a conversation.
 *
 * @param conversationId affected conversation
 * @param errorCode      recognizer error code
 * @param errorMessage   recognizer error description
 * @param timestamp      when the error was received
 */
public record RecognizerErrorEvent(String conversationId, String errorCode, String errorMessage, Instant timestamp) {
}
