package com.phillippitts.consulttranslator.service.router;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Joins recognized text fragments without corrupting word boundaries across scripts.
 *
 * <p>Merge rules, first match wins:
 * <ol>
 *   <li>Incoming starts with whitespace: concatenate (it brings its own separator)</li>
 *   <li>Either boundary character belongs to a script written without inter-word spaces
 *       (Telugu, Devanagari, Tamil, ...): concatenate</li>
 *   <li>Existing ends with whitespace: concatenate</li>
 *   <li>Incoming starts with clause punctuation {@code . , ! ? ; :}: concatenate</li>
 *   <li>Existing ends with clause punctuation: insert one space</li>
 *   <li>Both boundary characters are alphanumeric: insert one space, unless incoming is a short
 *       continuation fragment (e.g. {@code "er"}) split off the previous word</li>
 *   <li>Otherwise: concatenate</li>
 * </ol>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class TextMerger {

    /**
     * Fragments the recognizer is known to split off the end of a word.
     */
    public static final List<String> DEFAULT_CONTINUATION_FRAGMENTS = List.of(
            "er", "ed", "es", "ly", "ng", "st", "nd", "rd", "th", "ll", "ve", "re", "s");

    /** Maximum length of an incoming token that can be treated as a word continuation. */
    static final int MAX_CONTINUATION_LENGTH = 2;

    private static final String CLAUSE_PUNCTUATION = ".,!?;:";
    private static final String SENTENCE_TERMINALS = ".!?";

    private static final Set<Character.UnicodeScript> UNSPACED_SCRIPTS = EnumSet.of(
            Character.UnicodeScript.DEVANAGARI,
            Character.UnicodeScript.BENGALI,
            Character.UnicodeScript.GURMUKHI,
            Character.UnicodeScript.GUJARATI,
            Character.UnicodeScript.ORIYA,
            Character.UnicodeScript.TAMIL,
            Character.UnicodeScript.TELUGU,
            Character.UnicodeScript.KANNADA,
            Character.UnicodeScript.MALAYALAM,
            Character.UnicodeScript.SINHALA,
            Character.UnicodeScript.THAI,
            Character.UnicodeScript.LAO,
            Character.UnicodeScript.KHMER,
            Character.UnicodeScript.MYANMAR,
            Character.UnicodeScript.TIBETAN,
            Character.UnicodeScript.HAN,
            Character.UnicodeScript.HIRAGANA,
            Character.UnicodeScript.KATAKANA);

    private static final TextMerger DEFAULT = new TextMerger(DEFAULT_CONTINUATION_FRAGMENTS);

    private final Set<String> continuationFragments;

    /**
     * Creates a merger with a custom continuation fragment list. Fragments are matched
     * case-insensitively; entries longer than two characters can never match and are ignored.
     *
     * @param continuationFragments short word-continuation fragments (may be empty, not null)
     */
    public TextMerger(Collection<String> continuationFragments) {
        Set<String> fragments = new LinkedHashSet<>();
        for (String fragment : continuationFragments) {
            if (fragment != null && !fragment.isBlank() && fragment.length() <= MAX_CONTINUATION_LENGTH) {
                fragments.add(fragment.toLowerCase(Locale.ROOT));
            }
        }
        this.continuationFragments = Set.copyOf(fragments);
    }

    /**
     * Returns the shared merger using {@link #DEFAULT_CONTINUATION_FRAGMENTS}.
     */
    public static TextMerger withDefaults() {
        return DEFAULT;
    }

    /**
     * Merges {@code incoming} onto {@code existing}. Null is treated as empty; when either side
     * is empty the other is returned unchanged.
     *
     * @param existing text accumulated so far
     * @param incoming next fragment
     * @return merged text, never null
     */
    public String merge(String existing, String incoming) {
        if (existing == null || existing.isEmpty()) {
            return incoming == null ? "" : incoming;
        }
        if (incoming == null || incoming.isEmpty()) {
            return existing;
        }

        int last = existing.codePointBefore(existing.length());
        int first = incoming.codePointAt(0);

        if (Character.isWhitespace(first)) {
            return existing + incoming;
        }
        if (isUnspacedScript(last) || isUnspacedScript(first)) {
            return existing + incoming;
        }
        if (Character.isWhitespace(last)) {
            return existing + incoming;
        }
        if (isClausePunctuation(first)) {
            return existing + incoming;
        }
        if (isClausePunctuation(last)) {
            return existing + " " + incoming;
        }
        if (Character.isLetterOrDigit(last) && Character.isLetterOrDigit(first)) {
            if (isContinuationFragment(incoming)) {
                return existing + incoming;
            }
            return existing + " " + incoming;
        }
        return existing + incoming;
    }

    /**
     * Checks whether a fragment is a short suffix continuing the previous word.
     */
    boolean isContinuationFragment(String incoming) {
        return incoming.length() <= MAX_CONTINUATION_LENGTH
                && continuationFragments.contains(incoming.toLowerCase(Locale.ROOT));
    }

    /**
     * Checks whether a code point belongs to a script that joins words without spaces.
     *
     * @param codePoint Unicode code point
     * @return true for Indic and other unspaced scripts
     */
    public static boolean isUnspacedScript(int codePoint) {
        try {
            return UNSPACED_SCRIPTS.contains(Character.UnicodeScript.of(codePoint));
        } catch (IllegalArgumentException e) {
            // Not a valid code point
            return false;
        }
    }

    /**
     * Checks whether a code point is one of {@code . , ! ? ; :}.
     */
    public static boolean isClausePunctuation(int codePoint) {
        return codePoint < 128 && CLAUSE_PUNCTUATION.indexOf(codePoint) >= 0;
    }

    /**
     * Checks whether text ends a sentence ({@code . ! ?}), ignoring trailing whitespace.
     *
     * @param text text to inspect (may be null)
     * @return true when the last non-whitespace character is sentence-terminal
     */
    public static boolean endsSentence(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.stripTrailing();
        if (trimmed.isEmpty()) {
            return false;
        }
        int last = trimmed.codePointBefore(trimmed.length());
        return last < 128 && SENTENCE_TERMINALS.indexOf(last) >= 0;
    }
}
