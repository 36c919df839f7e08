package com.phillippitts.consulttranslator.domain;

import java.util.Locale;

/**
 * Whether a recognized token is the speaker's own words or a translation produced upstream.
 */
public enum TranslationStatus {
    ORIGINAL("original"),
    TRANSLATION("translation"),
    NONE("none");

    private final String wireValue;

    TranslationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Value used in recognizer messages and exported entries.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Parses a wire value leniently. Unrecognized or missing values map to {@link #NONE}.
     *
     * @param value wire value (may be null)
     * @return matching status, never null
     */
    public static TranslationStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TranslationStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        return NONE;
    }
}
