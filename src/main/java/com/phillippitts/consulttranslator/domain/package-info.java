/**
 * Immutable value types exchanged between the routing core and its collaborators.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.consulttranslator.domain.Token} - one recognized unit of speech</li>
 *   <li>{@link com.phillippitts.consulttranslator.domain.ConversationEntry} - raw per-view log record
 *       kept for export</li>
 *   <li>{@link com.phillippitts.consulttranslator.domain.ViewSnapshot} - display state of the three views</li>
 *   <li>{@link com.phillippitts.consulttranslator.domain.TokenOutcome} - what processing one token produced</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.consulttranslator.domain;
