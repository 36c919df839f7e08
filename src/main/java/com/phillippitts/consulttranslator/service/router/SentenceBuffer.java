package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.ConversationEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates final tokens for one view into speaker-tagged display lines.
 *
 * <p><b>States:</b>
 * <pre>
 * IDLE ──append──▶ ACCUMULATING(speaker)
 * ACCUMULATING(a) ──append by b──▶ flush line [a] ──▶ ACCUMULATING(b)
 * ACCUMULATING(a) ──merged text ends in . ! ?──▶ flush line [a] ──▶ IDLE
 * </pre>
 *
 * <p>Every append also logs a raw {@link ConversationEntry}, whether or not a line was flushed.
 * Finalized text is append-only; only the display rendering is truncated.
 *
 * <p>Lines are trimmed: the first token of a line drops its leading whitespace and a flushed
 * line drops trailing whitespace, so a line is {@code [speaker]: } plus the merged text stripped.
 *
 * <p>Not thread-safe; owned by a single {@link RouterState}.
 */
public final class SentenceBuffer {

    private final ViewKind view;
    private final TextMerger merger;
    private final int displayWindow;
    private final String placeholder;

    private final List<String> lines = new ArrayList<>();
    private final StringBuilder finalizedText = new StringBuilder();
    private final List<ConversationEntry> entries = new ArrayList<>();
    private String pending = "";
    private String pendingSpeaker;

    public SentenceBuffer(ViewKind view, RouterSettings settings) {
        this.view = Objects.requireNonNull(view, "view must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.merger = settings.merger();
        this.displayWindow = settings.displayWindow();
        this.placeholder = settings.placeholder();
    }

    /**
     * Appends a final token spoken by {@code speaker}.
     *
     * @param speaker   resolved speaker label
     * @param text      cleaned, non-blank token text
     * @param language  token language code
     * @param status    translation status wire value
     * @param timestamp ISO-8601 token time
     * @return logged entry and any lines finalized by this append
     */
    public AppendResult append(String speaker, String text, String language, String status, String timestamp) {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(text, "text must not be null");

        List<String> flushed = new ArrayList<>(2);
        if (!pending.isEmpty() && !speaker.equals(pendingSpeaker)) {
            flushed.add(flush());
        }
        pendingSpeaker = speaker;
        pending = pending.isEmpty() ? text.stripLeading() : merger.merge(pending, text);

        boolean sentenceCompleted = TextMerger.endsSentence(pending);
        if (sentenceCompleted) {
            flushed.add(flush());
        }

        ConversationEntry entry = new ConversationEntry(timestamp, speaker, text, language, status, view.wireName());
        entries.add(entry);
        return new AppendResult(entry, List.copyOf(flushed), sentenceCompleted);
    }

    private String flush() {
        String line = tag(pendingSpeaker, pending);
        lines.add(line);
        if (finalizedText.length() > 0) {
            finalizedText.append('\n');
        }
        finalizedText.append(line);
        pending = "";
        return line;
    }

    private static String tag(String speaker, String text) {
        return "[" + speaker + "]: " + text.stripTrailing();
    }

    /**
     * Finalized lines plus the in-progress line, limited to the trailing display window,
     * or the placeholder when the view is empty.
     */
    public String displayText() {
        boolean hasPending = !pending.isBlank();
        if (finalizedText.length() == 0 && !hasPending) {
            return placeholder;
        }
        // Only the trailing window of finalized text can survive truncation
        int from = Math.max(0, finalizedText.length() - displayWindow);
        StringBuilder visible = new StringBuilder(finalizedText.subSequence(from, finalizedText.length()));
        if (hasPending) {
            if (finalizedText.length() > 0) {
                visible.append('\n');
            }
            visible.append(tag(pendingSpeaker, pending));
        }
        return tail(visible, displayWindow);
    }

    /**
     * Finalized lines plus the in-progress line, untruncated.
     */
    public String fullText() {
        if (pending.isBlank()) {
            return finalizedText.toString();
        }
        StringBuilder full = new StringBuilder(finalizedText);
        if (full.length() > 0) {
            full.append('\n');
        }
        return full.append(tag(pendingSpeaker, pending)).toString();
    }

    private static String tail(CharSequence text, int window) {
        if (text.length() <= window) {
            return text.toString();
        }
        int start = text.length() - window;
        // Never start in the middle of a surrogate pair
        if (Character.isLowSurrogate(text.charAt(start))) {
            start++;
        }
        return text.subSequence(start, text.length()).toString();
    }

    /**
     * Complete, untruncated finalized text (lines joined by newlines).
     */
    public String finalizedText() {
        return finalizedText.toString();
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    public List<ConversationEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public String pendingText() {
        return pending;
    }

    /**
     * @return speaker of the current or most recent line, or {@code null} while idle since creation
     */
    public String lastSpeaker() {
        return pendingSpeaker;
    }

    public ViewKind view() {
        return view;
    }

    public boolean isEmpty() {
        return lines.isEmpty() && pending.isEmpty();
    }

    void clear() {
        lines.clear();
        finalizedText.setLength(0);
        entries.clear();
        pending = "";
        pendingSpeaker = null;
    }

    /**
     * Result of one {@link #append} call.
     *
     * @param entry             raw entry logged for the token
     * @param flushedLines      lines finalized by this append, oldest first (0 to 2), each trimmed
     * @param sentenceCompleted {@code true} when the merged text ended in {@code . ! ?}
     */
    public record AppendResult(ConversationEntry entry, List<String> flushedLines, boolean sentenceCompleted) {
    }
}
