package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.Token;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Three-tier speaker resolution with graceful degradation.
 *
 * <ol>
 *   <li><b>Diarization:</b> a real speaker hint is looked up (or registered) in the
 *       session's {@link SpeakerRegistry}</li>
 *   <li><b>Language:</b> in translation mode a known language picks the party speaking it;
 *       a translation is attributed by its source language when the recognizer supplies one</li>
 *   <li><b>Turn taking:</b> otherwise the {@link TurnTakingTracker}'s active speaker, which
 *       alternates on completed sentences in same-language mode</li>
 * </ol>
 *
 * <p>In translation mode the first two tiers also move the tracker, so signal-less tokens stay
 * with the last identified speaker. In same-language mode the active speaker only changes on a
 * completed sentence.
 */
public final class DefaultSpeakerResolver implements SpeakerResolver {

    private static final Set<String> SENTINEL_HINTS = Set.of("unknown", "none", "null");

    private final RouterState state;

    public DefaultSpeakerResolver(RouterState state) {
        this.state = Objects.requireNonNull(state, "state must not be null");
    }

    @Override
    public SpeakerAssignment resolve(Token token) {
        String hint = token.speakerHint();
        if (isRealHint(hint)) {
            String label = state.registry().labelFor(hint.trim());
            if (state.mode() == RoutingMode.TRANSLATION) {
                state.turnTaking().follow(label);
            }
            return new SpeakerAssignment(label, SpeakerAssignment.Source.DIARIZATION);
        }

        if (state.mode() == RoutingMode.TRANSLATION) {
            String label = labelForLanguage(spokenLanguage(token));
            if (label != null) {
                state.turnTaking().follow(label);
                return new SpeakerAssignment(label, SpeakerAssignment.Source.LANGUAGE);
            }
        }

        return new SpeakerAssignment(state.turnTaking().current(), SpeakerAssignment.Source.TURN_TAKING);
    }

    @Override
    public void onSentenceCompleted(SpeakerAssignment assignment) {
        if (state.mode() == RoutingMode.SAME_LANGUAGE
                && assignment.source() == SpeakerAssignment.Source.TURN_TAKING) {
            state.turnTaking().alternate();
        }
    }

    private static String spokenLanguage(Token token) {
        if (token.isTranslation() && token.sourceLanguage() != null) {
            return token.sourceLanguage();
        }
        return token.hasKnownLanguage() ? token.language() : null;
    }

    private String labelForLanguage(String language) {
        if (language == null) {
            return null;
        }
        if (language.equalsIgnoreCase(state.primaryLanguage())) {
            return state.labels().primary();
        }
        if (language.equalsIgnoreCase(state.secondaryLanguage())) {
            return state.labels().secondary();
        }
        return null;
    }

    static boolean isRealHint(String hint) {
        return hint != null
                && !hint.isBlank()
                && !SENTINEL_HINTS.contains(hint.trim().toLowerCase(Locale.ROOT));
    }
}
