package com.phillippitts.consulttranslator.presentation.controller;

import com.phillippitts.consulttranslator.service.session.ConversationSessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight liveness endpoint for load balancers and the browser client.
 */
@RestController
class HealthController {

    private final ConversationSessionRegistry sessions;

    HealthController(ConversationSessionRegistry sessions) {
        this.sessions = sessions;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "activeSessions", sessions.activeCount(),
                "timestamp", Instant.now().toString()
        ));
    }
}
