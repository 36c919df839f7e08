/**
 * Routing and buffering core for a live two-party conversation.
 *
 * <p>Every recognized token passes through the same pipeline:
 * <ol>
 *   <li>{@link com.phillippitts.consulttranslator.service.router.SpeakerResolver} attributes it
 *       to a speaker (diarization hint, then language, then turn taking)</li>
 *   <li>{@link com.phillippitts.consulttranslator.service.router.ViewRouter} picks the target
 *       views (Original, primary party, secondary party)</li>
 *   <li>each target {@link com.phillippitts.consulttranslator.service.router.SentenceBuffer}
 *       merges the text with {@link com.phillippitts.consulttranslator.service.router.TextMerger}
 *       and finalizes speaker-tagged lines at sentence ends and speaker changes</li>
 * </ol>
 *
 * <p>{@link com.phillippitts.consulttranslator.service.router.ConversationRouter} is the single
 * entry point. Nothing in this package performs I/O or depends on Spring; one router instance
 * serves exactly one conversation.
 *
 * @since 1.0
 */
package com.phillippitts.consulttranslator.service.router;
