/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.consulttranslator.exception.ConfigurationException} → 400 Bad Request</li>
 *   <li>{@code IllegalArgumentException} (invalid recording name) → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.consulttranslator.exception.RecordingNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.consulttranslator.exception.RecordingException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "RecordingNotFoundException",
 *   "message": "Recording not found",
 *   "details": "Doc-patient-EN_10192026_14_05.json",
 *   "timestamp": "2026-10-19T14:05:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.consulttranslator.presentation.exception;
