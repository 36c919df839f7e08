package com.phillippitts.consulttranslator.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One recognized unit of speech delivered by the upstream recognizer, in arrival order.
 *
 * @param text              recognized text (must not be null; may still clean up to empty)
 * @param speakerHint       opaque diarization identifier, or null when the recognizer gave none
 * @param language          language code, {@link #UNKNOWN_LANGUAGE} when not detected
 * @param isFinal           {@code true} when the recognizer will not revise this token
 * @param timestamp         ISO-8601 arrival time
 * @param translationStatus whether the text is original speech or a translation
 * @param sourceLanguage    spoken language a translation was produced from (may be null)
 */
public record Token(
        String text,
        String speakerHint,
        String language,
        boolean isFinal,
        String timestamp,
        TranslationStatus translationStatus,
        String sourceLanguage
) {

    /** Language value used when the recognizer did not label the token. */
    public static final String UNKNOWN_LANGUAGE = "unknown";

    /**
     * Compact constructor normalizing optional fields.
     *
     * @throws NullPointerException if text is null
     */
    public Token {
        Objects.requireNonNull(text, "Token text must not be null");
        language = (language == null || language.isBlank()) ? UNKNOWN_LANGUAGE : language.trim();
        timestamp = (timestamp == null || timestamp.isBlank()) ? Instant.now().toString() : timestamp;
        translationStatus = translationStatus == null ? TranslationStatus.NONE : translationStatus;
        sourceLanguage = (sourceLanguage == null || sourceLanguage.isBlank()) ? null : sourceLanguage.trim();
    }

    /**
     * Creates an original-speech token stamped with the current time.
     */
    public static Token of(String text, String speakerHint, String language, boolean isFinal) {
        return new Token(text, speakerHint, language, isFinal, null, TranslationStatus.ORIGINAL, null);
    }

    /**
     * Creates a final translation token stamped with the current time.
     */
    public static Token translation(String text, String speakerHint, String language, String sourceLanguage) {
        return new Token(text, speakerHint, language, true, null, TranslationStatus.TRANSLATION, sourceLanguage);
    }

    public boolean hasKnownLanguage() {
        return !UNKNOWN_LANGUAGE.equalsIgnoreCase(language);
    }

    public boolean isTranslation() {
        return translationStatus == TranslationStatus.TRANSLATION;
    }

    /**
     * Returns a copy carrying different text, used after cleanup.
     */
    public Token withText(String newText) {
        return new Token(newText, speakerHint, language, isFinal, timestamp, translationStatus, sourceLanguage);
    }
}
