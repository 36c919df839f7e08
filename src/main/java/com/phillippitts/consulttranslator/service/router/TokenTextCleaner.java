package com.phillippitts.consulttranslator.service.router;

/**
 * Normalizes raw recognizer token text before routing.
 *
 * <p>Tabs and line breaks become spaces, other control characters and the recognizer's
 * {@code <end>} endpoint marker are removed. Leading whitespace is preserved because it
 * carries word-separation information for {@link TextMerger}.
 */
final class TokenTextCleaner {

    static final String ENDPOINT_MARKER = "<end>";

    private TokenTextCleaner() {
        // Utility class - prevent instantiation
    }

    /**
     * @param raw raw token text (may be null)
     * @return cleaned text, empty when nothing usable remains
     */
    static String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = raw.replace(ENDPOINT_MARKER, "");
        StringBuilder cleaned = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t' || c == '\n' || c == '\r') {
                cleaned.append(' ');
            } else if (!Character.isISOControl(c)) {
                cleaned.append(c);
            }
        }
        return cleaned.toString().isBlank() ? "" : cleaned.toString();
    }
}
