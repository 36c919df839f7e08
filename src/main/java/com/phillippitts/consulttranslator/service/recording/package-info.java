/**
 * Persistence of finished conversations as JSON files.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.consulttranslator.service.recording.ConversationRecorder} - writes the
 *       Original and both party views, lists and loads saved files</li>
 *   <li>{@code ConversationRecordingListener} - saves each conversation when its session ends</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.consulttranslator.service.recording;
