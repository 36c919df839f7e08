/**
 * Presentation layer (WebSocket transport, REST controllers and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - live conversation endpoint</li>
 *   <li>{@code presentation.controller} - health and recording endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Adapters here are thin: routing lives in {@code service.router}, persistence in
 * {@code service.recording}.
 *
 * @since 1.0
 */
package com.phillippitts.consulttranslator.presentation;
