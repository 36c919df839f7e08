package com.phillippitts.consulttranslator.service.events;

import com.phillippitts.consulttranslator.domain.ConversationTranscript;

import java.time.Instant;

/**
 * Emitted when a live conversation closes, carrying everything it produced.
 *
 * @param transcript detached copy of the conversation's views and entries
 * @param timestamp  when the session ended
 */
public record ConversationEndedEvent(ConversationTranscript transcript, Instant timestamp) {
}
