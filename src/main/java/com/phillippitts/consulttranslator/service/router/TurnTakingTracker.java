package com.phillippitts.consulttranslator.service.router;

import java.util.Objects;

/**
 * Best-effort guess of the active speaker when no diarization or language signal exists.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * UNSET → primary (first signal-less token)
 * primary ⇄ secondary (completed sentence in same-language fallback)
 * any → label (translation mode: a diarized or language-resolved token names the speaker)
 * </pre>
 *
 * <p>Not thread-safe; owned by a single {@link RouterState}.
 */
public final class TurnTakingTracker {

    private final SpeakerLabels labels;
    private String activeSpeaker;

    public TurnTakingTracker(SpeakerLabels labels) {
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    /**
     * Returns the active speaker, starting with the primary party on first use.
     */
    public String current() {
        if (activeSpeaker == null) {
            activeSpeaker = labels.primary();
        }
        return activeSpeaker;
    }

    /**
     * Records a speaker identified by a stronger signal.
     */
    public void follow(String speaker) {
        this.activeSpeaker = Objects.requireNonNull(speaker, "speaker must not be null");
    }

    /**
     * Hands the turn to the other party. Any speaker other than the primary hands to the primary.
     */
    public void alternate() {
        activeSpeaker = labels.primary().equals(current()) ? labels.secondary() : labels.primary();
    }

    /**
     * @return active speaker, or {@code null} before the first token
     */
    public String activeSpeaker() {
        return activeSpeaker;
    }

    void clear() {
        activeSpeaker = null;
    }
}
