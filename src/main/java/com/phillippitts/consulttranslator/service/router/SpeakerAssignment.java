package com.phillippitts.consulttranslator.service.router;

import java.util.Objects;

/**
 * A resolved speaker label together with the signal that produced it.
 *
 * @param label  speaker label, never null
 * @param source which resolution tier matched
 */
public record SpeakerAssignment(String label, Source source) {

    /** Resolution tiers, strongest first. */
    public enum Source { DIARIZATION, LANGUAGE, TURN_TAKING }

    public SpeakerAssignment {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }
}
