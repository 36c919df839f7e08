/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code conversationId} - WebSocket session id, set while a live message is handled</li>
 * </ul>
 *
 * @see com.phillippitts.consulttranslator.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.consulttranslator.config.logging;
