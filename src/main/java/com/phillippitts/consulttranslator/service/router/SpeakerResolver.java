package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.Token;

/**
 * Assigns a stable speaker label to every token using the best available signal.
 *
 * <p>The turn-taking heuristic lives behind this interface so a real diarization signal can
 * replace it without touching buffering or routing.
 */
public interface SpeakerResolver {

    /**
     * Resolves the speaker of a token. Never fails.
     *
     * @param token incoming token (partial or final)
     * @return assignment with a non-null label
     */
    SpeakerAssignment resolve(Token token);

    /**
     * Notifies the resolver that a final token completed a sentence in the Original view.
     *
     * @param assignment assignment of the token that completed the sentence
     */
    void onSentenceCompleted(SpeakerAssignment assignment);
}
