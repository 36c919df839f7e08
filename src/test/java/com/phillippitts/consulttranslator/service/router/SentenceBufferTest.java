package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.ConversationEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SentenceBufferTest {

    private SentenceBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new SentenceBuffer(ViewKind.ORIGINAL, RouterSettings.DEFAULT);
    }

    private SentenceBuffer.AppendResult append(String speaker, String text) {
        return buffer.append(speaker, text, "en", "original", "2026-10-19T10:00:00Z");
    }

    @Test
    void shouldShowPlaceholderWhenEmpty() {
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.displayText()).isEqualTo(RouterSettings.DEFAULT_PLACEHOLDER);
        assertThat(buffer.finalizedText()).isEmpty();
        assertThat(buffer.lastSpeaker()).isNull();
    }

    @Test
    void shouldKeepIncompleteSentencePending() {
        SentenceBuffer.AppendResult result = append("Doctor", "Hello");

        assertThat(result.flushedLines()).isEmpty();
        assertThat(result.sentenceCompleted()).isFalse();
        assertThat(buffer.pendingText()).isEqualTo("Hello");
        assertThat(buffer.finalizedText()).isEmpty();
        assertThat(buffer.displayText()).isEqualTo("[Doctor]: Hello");
    }

    @Test
    void shouldFlushTaggedLineWhenSentenceEnds() {
        append("Doctor", "Hello");
        SentenceBuffer.AppendResult result = append("Doctor", " world.");

        assertThat(result.sentenceCompleted()).isTrue();
        assertThat(result.flushedLines()).containsExactly("[Doctor]: Hello world.");
        assertThat(buffer.pendingText()).isEmpty();
        assertThat(buffer.finalizedText()).isEqualTo("[Doctor]: Hello world.");
        assertThat(buffer.lines()).containsExactly("[Doctor]: Hello world.");
    }

    @Test
    void shouldFlushPreviousSpeakerOnSpeakerChange() {
        append("Doctor", "How are you");
        SentenceBuffer.AppendResult result = append("Patient", "Fine");

        assertThat(result.flushedLines()).containsExactly("[Doctor]: How are you");
        assertThat(buffer.pendingText()).isEqualTo("Fine");
        assertThat(buffer.lastSpeaker()).isEqualTo("Patient");
        assertThat(buffer.displayText()).isEqualTo("[Doctor]: How are you\n[Patient]: Fine");
    }

    @Test
    void shouldFlushTwoLinesWhenSpeakerChangesOnCompleteSentence() {
        append("Doctor", "Take these daily");
        SentenceBuffer.AppendResult result = append("Patient", "Okay.");

        assertThat(result.flushedLines()).containsExactly("[Doctor]: Take these daily", "[Patient]: Okay.");
        assertThat(buffer.finalizedText()).isEqualTo("[Doctor]: Take these daily\n[Patient]: Okay.");
    }

    @Test
    void shouldStripLeadingWhitespaceOfNewLine() {
        append("Doctor", "   Hello");

        assertThat(buffer.pendingText()).isEqualTo("Hello");
    }

    @Test
    void shouldStartNewLineForSameSpeakerAfterSentence() {
        append("Doctor", "One.");
        append("Doctor", " Two.");

        assertThat(buffer.lines()).containsExactly("[Doctor]: One.", "[Doctor]: Two.");
    }

    @Test
    void shouldMergeUsingTextMergerRules() {
        append("Doctor", "Great");
        append("Doctor", "er");
        append("Doctor", " news.");

        assertThat(buffer.finalizedText()).isEqualTo("[Doctor]: Greater news.");
    }

    @Test
    void shouldLogEveryAppendAsEntry() {
        append("Doctor", "Hello");
        append("Doctor", " there.");

        assertThat(buffer.entries()).hasSize(2);
        ConversationEntry first = buffer.entries().get(0);
        assertThat(first.speaker()).isEqualTo("Doctor");
        assertThat(first.text()).isEqualTo("Hello");
        assertThat(first.language()).isEqualTo("en");
        assertThat(first.status()).isEqualTo("original");
        assertThat(first.view()).isEqualTo("original");
        assertThat(first.timestamp()).isEqualTo("2026-10-19T10:00:00Z");
    }

    @Test
    void shouldTruncateDisplayToTrailingWindowOnly() {
        SentenceBuffer small = new SentenceBuffer(ViewKind.PRIMARY,
                new RouterSettings(SpeakerLabels.DEFAULT, TextMerger.withDefaults(), 10, "-"));

        small.append("Doctor", "Hello world.", "en", "original", "t");

        assertThat(small.displayText()).isEqualTo("llo world.");
        assertThat(small.finalizedText()).isEqualTo("[Doctor]: Hello world.");
    }

    @Test
    void shouldShowTrailingWindowOfFinalizedAndPendingText() {
        SentenceBuffer small = new SentenceBuffer(ViewKind.ORIGINAL,
                new RouterSettings(SpeakerLabels.DEFAULT, TextMerger.withDefaults(), 20, "-"));
        String[][] turns = {
                {"Doctor", "Hello."}, {"Patient", "Fine."}, {"Doctor", "Any"}, {"Doctor", " pain"}, {"Doctor", "?"}};

        for (String[] turn : turns) {
            small.append(turn[0], turn[1], "en", "original", "t");
            String full = small.fullText();

            assertThat(small.displayText()).isEqualTo(full.substring(Math.max(0, full.length() - 20)));
        }
        assertThat(small.displayText()).isEqualTo("\n[Doctor]: Any pain?");
    }

    @Test
    void shouldTrimFlushedLines() {
        SentenceBuffer.AppendResult result = append("Doctor", "  Hello there.  ");

        assertThat(result.flushedLines()).containsExactly("[Doctor]: Hello there.");
        assertThat(result.entry().text()).isEqualTo("  Hello there.  ");
    }

    @Test
    void shouldNotSplitSurrogatePairWhenTruncating() {
        SentenceBuffer small = new SentenceBuffer(ViewKind.PRIMARY,
                new RouterSettings(SpeakerLabels.DEFAULT, TextMerger.withDefaults(), 3, "-"));

        // "😀" is one emoji (two chars); window of 3 would start on its low surrogate
        small.append("Doctor", "x😀ab", "en", "original", "t");

        assertThat(small.displayText()).isEqualTo("ab");
    }

    @Test
    void shouldReturnToInitialStateWhenCleared() {
        append("Doctor", "Hello.");
        append("Patient", "Hi");

        buffer.clear();

        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.entries()).isEmpty();
        assertThat(buffer.displayText()).isEqualTo(RouterSettings.DEFAULT_PLACEHOLDER);
        assertThat(buffer.lastSpeaker()).isNull();
    }

    @Test
    void shouldRejectNullSpeaker() {
        assertThatThrownBy(() -> append(null, "Hello"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("speaker");
    }
}
