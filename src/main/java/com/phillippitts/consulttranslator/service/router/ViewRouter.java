package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.Token;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which views receive a final token and appends it to their buffers.
 *
 * <p><b>Original:</b> every token that is not a translation.
 *
 * <p><b>Same-language mode:</b> a per-party view receives a token only when both the language
 * and the speaker match that party; anything else is treated as noise for that view.
 *
 * <p><b>Translation mode:</b> a per-party view receives tokens in its language. A translation
 * whose language matches neither party goes to both per-party views, since a translation is
 * always rendered in a listener's language.
 */
public final class ViewRouter {

    private final RouterState state;

    public ViewRouter(RouterState state) {
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    /**
     * Appends a final token to every view it belongs in.
     *
     * @param speaker resolved speaker label
     * @param token   cleaned final token
     * @return append results keyed by receiving view, in view order
     */
    public Map<ViewKind, SentenceBuffer.AppendResult> distribute(String speaker, Token token) {
        Map<ViewKind, SentenceBuffer.AppendResult> results = new EnumMap<>(ViewKind.class);
        for (ViewKind kind : targets(speaker, token)) {
            results.put(kind, state.view(kind).append(
                    speaker,
                    token.text(),
                    token.language(),
                    token.translationStatus().wireValue(),
                    token.timestamp()));
        }
        return results;
    }

    /**
     * Computes the receiving views without touching any buffer.
     */
    public Set<ViewKind> targets(String speaker, Token token) {
        Set<ViewKind> targets = EnumSet.noneOf(ViewKind.class);
        if (!token.isTranslation()) {
            targets.add(ViewKind.ORIGINAL);
        }

        boolean primaryLanguage = token.language().equalsIgnoreCase(state.primaryLanguage());
        boolean secondaryLanguage = token.language().equalsIgnoreCase(state.secondaryLanguage());

        if (state.mode() == RoutingMode.SAME_LANGUAGE) {
            if (primaryLanguage && speaker.equals(state.labels().primary())) {
                targets.add(ViewKind.PRIMARY);
            }
            if (secondaryLanguage && speaker.equals(state.labels().secondary())) {
                targets.add(ViewKind.SECONDARY);
            }
            return targets;
        }

        if (token.isTranslation() && !primaryLanguage && !secondaryLanguage) {
            targets.add(ViewKind.PRIMARY);
            targets.add(ViewKind.SECONDARY);
            return targets;
        }
        if (primaryLanguage) {
            targets.add(ViewKind.PRIMARY);
        }
        if (secondaryLanguage) {
            targets.add(ViewKind.SECONDARY);
        }
        return targets;
    }
}
