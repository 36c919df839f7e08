/**
 * WebSocket transport for live conversations.
 */
package com.phillippitts.consulttranslator.presentation.websocket;
