package com.phillippitts.consulttranslator.service.router;

/**
 * How the per-party views are populated, derived from the configured language pair.
 */
public enum RoutingMode {
    /** Two distinct party languages; routing follows language tags and translation status. */
    TRANSLATION,
    /** Both parties share one language; routing follows speaker identity only. */
    SAME_LANGUAGE;

    /**
     * Derives the mode for a language pair (compared case-insensitively).
     */
    public static RoutingMode forLanguages(String primaryLanguage, String secondaryLanguage) {
        return primaryLanguage.equalsIgnoreCase(secondaryLanguage) ? SAME_LANGUAGE : TRANSLATION;
    }
}
