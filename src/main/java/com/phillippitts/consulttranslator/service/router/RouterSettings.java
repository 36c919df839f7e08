package com.phillippitts.consulttranslator.service.router;

import java.util.Objects;

/**
 * Immutable per-deployment settings shared by every router a factory creates.
 *
 * @param labels        party display labels
 * @param merger        text merge rules
 * @param displayWindow number of trailing characters kept in each view snapshot
 * @param placeholder   text shown for a view with no content yet
 */
public record RouterSettings(SpeakerLabels labels, TextMerger merger, int displayWindow, String placeholder) {

    /** Trailing characters shown per view unless configured otherwise. */
    public static final int DEFAULT_DISPLAY_WINDOW = 2000;

    /** Text shown for an empty view unless configured otherwise. */
    public static final String DEFAULT_PLACEHOLDER = "[Waiting for speech...]";

    public static final RouterSettings DEFAULT = new RouterSettings(
            SpeakerLabels.DEFAULT, TextMerger.withDefaults(), DEFAULT_DISPLAY_WINDOW, DEFAULT_PLACEHOLDER);

    public RouterSettings {
        Objects.requireNonNull(labels, "labels must not be null");
        Objects.requireNonNull(merger, "merger must not be null");
        Objects.requireNonNull(placeholder, "placeholder must not be null");
        if (displayWindow < 1) {
            throw new IllegalArgumentException("displayWindow must be >= 1, got: " + displayWindow);
        }
    }
}
