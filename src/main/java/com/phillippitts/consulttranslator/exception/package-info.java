/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.consulttranslator.exception.TranslatorException} - base for all
 *       application errors</li>
 *   <li>{@link com.phillippitts.consulttranslator.exception.ConfigurationException} - raised synchronously
 *       when a session's language pair is rejected; the only error the routing core throws</li>
 *   <li>{@link com.phillippitts.consulttranslator.exception.RecordingException} - conversation files could
 *       not be written or read</li>
 *   <li>{@link com.phillippitts.consulttranslator.exception.RecordingNotFoundException} - a requested
 *       recording does not exist</li>
 * </ul>
 *
 * <p>Per-token anomalies (missing text, unknown language, absent speaker hint) are never exceptions;
 * the router degrades silently instead.
 *
 * @see com.phillippitts.consulttranslator.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.consulttranslator.exception;
