/**
 * Spring configuration: typed properties, routing core wiring and the WebSocket endpoint.
 */
package com.phillippitts.consulttranslator.config;
