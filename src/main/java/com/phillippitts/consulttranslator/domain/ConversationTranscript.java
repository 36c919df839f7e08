package com.phillippitts.consulttranslator.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything a finished conversation produced, detached from the live router.
 *
 * @param conversationId     session identifier
 * @param primaryLanguage    primary party's language
 * @param secondaryLanguage  secondary party's language
 * @param originalText       full Original view text, including any unfinished line
 * @param primaryText        full primary view text
 * @param secondaryText      full secondary view text
 * @param entries            every logged entry in arrival order
 * @param primaryEntries     entries logged by the primary view
 * @param secondaryEntries   entries logged by the secondary view
 * @param endedAt            when the transcript was taken
 */
public record ConversationTranscript(
        String conversationId,
        String primaryLanguage,
        String secondaryLanguage,
        String originalText,
        String primaryText,
        String secondaryText,
        List<ConversationEntry> entries,
        List<ConversationEntry> primaryEntries,
        List<ConversationEntry> secondaryEntries,
        Instant endedAt
) {

    public ConversationTranscript {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Objects.requireNonNull(primaryLanguage, "primaryLanguage must not be null");
        Objects.requireNonNull(secondaryLanguage, "secondaryLanguage must not be null");
        originalText = originalText == null ? "" : originalText;
        primaryText = primaryText == null ? "" : primaryText;
        secondaryText = secondaryText == null ? "" : secondaryText;
        entries = entries == null ? List.of() : List.copyOf(entries);
        primaryEntries = primaryEntries == null ? List.of() : List.copyOf(primaryEntries);
        secondaryEntries = secondaryEntries == null ? List.of() : List.copyOf(secondaryEntries);
        Objects.requireNonNull(endedAt, "endedAt must not be null");
    }

    /**
     * @return true when the Original view holds any text worth saving
     */
    public boolean hasContent() {
        return !originalText.isBlank();
    }
}
