package com.phillippitts.consulttranslator.service.router;

import java.util.Objects;

/**
 * Display labels for the two parties of a conversation.
 *
 * @param primary   label of the first registered speaker (e.g. "Doctor")
 * @param secondary label of the second registered speaker (e.g. "Patient")
 */
public record SpeakerLabels(String primary, String secondary) {

    public static final SpeakerLabels DEFAULT = new SpeakerLabels("Doctor", "Patient");

    public SpeakerLabels {
        Objects.requireNonNull(primary, "primary label must not be null");
        Objects.requireNonNull(secondary, "secondary label must not be null");
        if (primary.equals(secondary)) {
            throw new IllegalArgumentException("Speaker labels must differ, got: " + primary);
        }
    }

    /**
     * Label for a speaker beyond the two parties, by 1-based registration order.
     */
    public String extra(int ordinal) {
        return "Speaker " + ordinal;
    }
}
