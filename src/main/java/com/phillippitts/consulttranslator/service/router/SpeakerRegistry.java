package com.phillippitts.consulttranslator.service.router;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Session-scoped mapping from opaque diarization hints to speaker labels.
 *
 * <p>The first hint seen becomes the primary party, the second the secondary party, and any
 * further hint gets a generated {@code "Speaker N"} label. A mapping is never reassigned or
 * removed until {@link #clear()} starts a new session.
 *
 * <p>Not thread-safe; owned by a single {@link RouterState}.
 */
public final class SpeakerRegistry {

    private final SpeakerLabels labels;
    private final Map<String, String> assignments = new LinkedHashMap<>();

    public SpeakerRegistry(SpeakerLabels labels) {
        this.labels = Objects.requireNonNull(labels, "labels must not be null");
    }

    /**
     * Returns the label registered for a hint, registering it first if unseen.
     *
     * @param hint non-blank diarization hint
     * @return stable label for the hint
     */
    public String labelFor(String hint) {
        Objects.requireNonNull(hint, "hint must not be null");
        return assignments.computeIfAbsent(hint, h -> nextLabel());
    }

    private String nextLabel() {
        int ordinal = assignments.size() + 1;
        return switch (ordinal) {
            case 1 -> labels.primary();
            case 2 -> labels.secondary();
            default -> labels.extra(ordinal);
        };
    }

    /**
     * Read-only view of registered hints in registration order.
     */
    public Map<String, String> assignments() {
        return Collections.unmodifiableMap(assignments);
    }

    public int size() {
        return assignments.size();
    }

    void clear() {
        assignments.clear();
    }
}
