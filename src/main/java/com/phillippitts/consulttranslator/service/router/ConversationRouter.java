package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.ConversationEntry;
import com.phillippitts.consulttranslator.domain.ConversationTranscript;
import com.phillippitts.consulttranslator.domain.Token;
import com.phillippitts.consulttranslator.domain.TokenOutcome;
import com.phillippitts.consulttranslator.domain.ViewSnapshot;
import com.phillippitts.consulttranslator.exception.ConfigurationException;
import com.phillippitts.consulttranslator.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes a live stream of recognized tokens into the three views of one conversation.
 *
 * <p>Per token: clean the text, resolve the speaker, keep partials as live preview only, and
 * distribute finals to the Original and per-party views, where they are merged into
 * speaker-tagged lines.
 *
 * <p><b>Thread Safety:</b> not thread-safe. Each conversation owns one instance and must feed
 * it tokens in arrival order from one caller at a time; the buffering decisions depend on
 * strict ordering of final tokens. Nothing in this class blocks or performs I/O.
 *
 * <p><b>Error Handling:</b> only {@link #configure} throws. Null tokens and tokens whose text
 * cleans to nothing are dropped without any state change.
 *
 * @since 1.0
 */
public class ConversationRouter {

    private static final Logger LOG = LogManager.getLogger(ConversationRouter.class);

    private static final int LOG_PREVIEW_CHARS = 40;

    private final RouterSettings settings;

    private RouterState state;
    private SpeakerResolver resolver;
    private ViewRouter viewRouter;

    /**
     * Creates a router already configured for a language pair.
     *
     * @param settings          shared router settings
     * @param primaryLanguage   primary party's language
     * @param secondaryLanguage secondary party's language
     * @throws ConfigurationException if a language is blank
     */
    public ConversationRouter(RouterSettings settings, String primaryLanguage, String secondaryLanguage) {
        this(settings, primaryLanguage, secondaryLanguage, false);
    }

    /**
     * Creates a router already configured for a language pair.
     *
     * @param translationRequired when {@code true}, equal languages are rejected
     * @throws ConfigurationException if the language pair is rejected
     */
    public ConversationRouter(RouterSettings settings, String primaryLanguage, String secondaryLanguage,
                              boolean translationRequired) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        configure(primaryLanguage, secondaryLanguage, translationRequired);
    }

    /**
     * Starts a new session for a language pair. Equal languages select same-language mode.
     *
     * @throws ConfigurationException if a language is blank
     */
    public void configure(String primaryLanguage, String secondaryLanguage) {
        configure(primaryLanguage, secondaryLanguage, false);
    }

    /**
     * Starts a new session for a language pair, discarding all previous state.
     *
     * @param primaryLanguage     primary party's language code
     * @param secondaryLanguage   secondary party's language code
     * @param translationRequired when {@code true}, equal languages are rejected
     * @throws ConfigurationException if a language is blank, or languages are equal while
     *                                translation is required
     */
    public void configure(String primaryLanguage, String secondaryLanguage, boolean translationRequired) {
        if (primaryLanguage == null || primaryLanguage.isBlank()
                || secondaryLanguage == null || secondaryLanguage.isBlank()) {
            throw new ConfigurationException("Both party languages must be set", primaryLanguage, secondaryLanguage);
        }
        String primary = primaryLanguage.trim();
        String secondary = secondaryLanguage.trim();
        RoutingMode mode = RoutingMode.forLanguages(primary, secondary);
        if (translationRequired && mode == RoutingMode.SAME_LANGUAGE) {
            throw new ConfigurationException("Party languages must differ for translation", primary, secondary);
        }

        RouterState newState = new RouterState(primary, secondary, settings);
        this.state = newState;
        this.resolver = new DefaultSpeakerResolver(newState);
        this.viewRouter = new ViewRouter(newState);
        LOG.info("Conversation configured: primary={}, secondary={}, mode={}", primary, secondary, mode);
    }

    /**
     * Processes one token in arrival order.
     *
     * @param token recognized token (null is ignored)
     * @return latest partials per speaker, plus a snapshot when the token was final
     */
    public TokenOutcome processToken(Token token) {
        if (token == null) {
            return TokenOutcome.dropped();
        }
        String text = TokenTextCleaner.clean(token.text());
        if (text.isEmpty()) {
            LOG.debug("Dropped token with no usable text");
            return TokenOutcome.dropped();
        }
        Token cleaned = token.withText(text);
        SpeakerAssignment assignment = resolver.resolve(cleaned);
        String speaker = assignment.label();

        if (!cleaned.isFinal()) {
            state.latestPartials().put(speaker, text);
            return new TokenOutcome(speaker, state.latestPartials(), Optional.empty());
        }

        state.latestPartials().remove(speaker);
        Map<ViewKind, SentenceBuffer.AppendResult> results = viewRouter.distribute(speaker, cleaned);
        results.values().forEach(result -> state.log(result.entry()));

        SentenceBuffer.AppendResult original = results.get(ViewKind.ORIGINAL);
        if (original != null && original.sentenceCompleted()) {
            resolver.onSentenceCompleted(assignment);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Final token: speaker={}, via={}, lang={}, status={}, views={}, text=\"{}\"",
                    speaker, assignment.source(), cleaned.language(),
                    cleaned.translationStatus().wireValue(), results.keySet(),
                    LogSanitizer.preview(text, LOG_PREVIEW_CHARS));
        }
        return new TokenOutcome(speaker, state.latestPartials(), Optional.of(snapshot()));
    }

    /**
     * Current display state of all three views, each limited to the display window.
     */
    public ViewSnapshot snapshot() {
        return new ViewSnapshot(
                state.view(ViewKind.ORIGINAL).displayText(),
                state.view(ViewKind.PRIMARY).displayText(),
                state.view(ViewKind.SECONDARY).displayText());
    }

    /**
     * Every raw entry logged by any view this session, in arrival order.
     */
    public List<ConversationEntry> exportEntries() {
        return List.copyOf(state.entryLog());
    }

    /**
     * Raw entries logged by one view.
     */
    public List<ConversationEntry> exportEntries(ViewKind view) {
        return List.copyOf(state.view(view).entries());
    }

    /**
     * Immutable copy of everything this session produced, for persistence once it ends.
     *
     * @param conversationId identifier of the session
     */
    public ConversationTranscript transcript(String conversationId) {
        return new ConversationTranscript(
                conversationId,
                state.primaryLanguage(),
                state.secondaryLanguage(),
                state.view(ViewKind.ORIGINAL).fullText(),
                state.view(ViewKind.PRIMARY).fullText(),
                state.view(ViewKind.SECONDARY).fullText(),
                exportEntries(),
                exportEntries(ViewKind.PRIMARY),
                exportEntries(ViewKind.SECONDARY),
                Instant.now());
    }

    /**
     * Untruncated finalized text of one view.
     */
    public String finalizedText(ViewKind view) {
        return state.view(view).finalizedText();
    }

    /**
     * Latest provisional text per speaker.
     */
    public Map<String, String> latestPartials() {
        return Map.copyOf(state.latestPartials());
    }

    /**
     * @return true once any final token reached the Original view
     */
    public boolean hasContent() {
        return !state.view(ViewKind.ORIGINAL).isEmpty();
    }

    /**
     * Clears all session state, keeping the configured language pair.
     */
    public void reset() {
        state.clear();
        LOG.info("Conversation reset: primary={}, secondary={}", state.primaryLanguage(), state.secondaryLanguage());
    }

    public String primaryLanguage() {
        return state.primaryLanguage();
    }

    public String secondaryLanguage() {
        return state.secondaryLanguage();
    }

    public RoutingMode mode() {
        return state.mode();
    }

    /**
     * Speaker hints registered so far, in registration order.
     */
    public Map<String, String> speakerAssignments() {
        return state.registry().assignments();
    }
}
