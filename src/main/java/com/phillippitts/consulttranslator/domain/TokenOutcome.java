package com.phillippitts.consulttranslator.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Observable result of processing one token.
 *
 * @param speaker                 label the token was attributed to, or null when it was dropped
 * @param latestPartialsBySpeaker provisional text per speaker, in first-seen order
 * @param snapshot                view snapshot, present only when the token was final and routed
 */
public record TokenOutcome(String speaker, Map<String, String> latestPartialsBySpeaker, Optional<ViewSnapshot> snapshot) {

    private static final TokenOutcome DROPPED = new TokenOutcome(null, Map.of(), Optional.empty());

    public TokenOutcome {
        latestPartialsBySpeaker = latestPartialsBySpeaker == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(latestPartialsBySpeaker));
        snapshot = snapshot == null ? Optional.empty() : snapshot;
    }

    /**
     * Outcome for a token that was discarded before reaching any state.
     */
    public static TokenOutcome dropped() {
        return DROPPED;
    }

    public boolean isDropped() {
        return speaker == null;
    }

    public boolean isFinal() {
        return snapshot.isPresent();
    }
}
