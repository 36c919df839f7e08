package com.phillippitts.consulttranslator.domain;

import java.util.Objects;

/**
 * Raw record of one final token as logged by a view, kept in full for export
 * regardless of display truncation.
 *
 * @param timestamp ISO-8601 time of the token
 * @param speaker   resolved speaker label
 * @param text      token text as received (after cleanup)
 * @param language  language code of the token
 * @param status    translation status wire value ({@code original}, {@code translation}, {@code none})
 * @param view      wire name of the view that logged the entry
 */
public record ConversationEntry(
        String timestamp,
        String speaker,
        String text,
        String language,
        String status,
        String view
) {

    public ConversationEntry {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(view, "view must not be null");
    }
}
