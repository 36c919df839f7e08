package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.ConversationEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All mutable state of one conversation session, owned by exactly one {@link ConversationRouter}.
 *
 * <p>Holding everything in one object makes "one router per session, nothing shared" structural:
 * the resolver and view router of a session only ever see this instance.
 */
public final class RouterState {

    private final String primaryLanguage;
    private final String secondaryLanguage;
    private final RoutingMode mode;
    private final SpeakerLabels labels;
    private final SpeakerRegistry registry;
    private final TurnTakingTracker turnTaking;
    private final Map<String, String> latestPartials = new LinkedHashMap<>();
    private final Map<ViewKind, SentenceBuffer> views = new EnumMap<>(ViewKind.class);
    private final List<ConversationEntry> entryLog = new ArrayList<>();

    RouterState(String primaryLanguage, String secondaryLanguage, RouterSettings settings) {
        this.primaryLanguage = Objects.requireNonNull(primaryLanguage, "primaryLanguage must not be null");
        this.secondaryLanguage = Objects.requireNonNull(secondaryLanguage, "secondaryLanguage must not be null");
        this.mode = RoutingMode.forLanguages(primaryLanguage, secondaryLanguage);
        this.labels = settings.labels();
        this.registry = new SpeakerRegistry(labels);
        this.turnTaking = new TurnTakingTracker(labels);
        for (ViewKind kind : ViewKind.values()) {
            views.put(kind, new SentenceBuffer(kind, settings));
        }
    }

    public String primaryLanguage() {
        return primaryLanguage;
    }

    public String secondaryLanguage() {
        return secondaryLanguage;
    }

    public RoutingMode mode() {
        return mode;
    }

    public SpeakerLabels labels() {
        return labels;
    }

    public SpeakerRegistry registry() {
        return registry;
    }

    public TurnTakingTracker turnTaking() {
        return turnTaking;
    }

    public SentenceBuffer view(ViewKind kind) {
        return views.get(kind);
    }

    Map<String, String> latestPartials() {
        return latestPartials;
    }

    void log(ConversationEntry entry) {
        entryLog.add(entry);
    }

    List<ConversationEntry> entryLog() {
        return Collections.unmodifiableList(entryLog);
    }

    /**
     * Returns every piece of session state to its just-configured condition.
     */
    void clear() {
        registry.clear();
        turnTaking.clear();
        latestPartials.clear();
        views.values().forEach(SentenceBuffer::clear);
        entryLog.clear();
    }
}
