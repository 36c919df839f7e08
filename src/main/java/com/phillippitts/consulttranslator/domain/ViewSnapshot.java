package com.phillippitts.consulttranslator.domain;

/**
 * Read-only display state of the three views, each already truncated to the display window.
 *
 * @param original  bilingual transcript tagged by speaker
 * @param primary   primary party's view
 * @param secondary secondary party's view
 */
public record ViewSnapshot(String original, String primary, String secondary) {
}
