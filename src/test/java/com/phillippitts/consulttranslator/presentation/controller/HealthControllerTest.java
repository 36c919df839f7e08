package com.phillippitts.consulttranslator.presentation.controller;

import com.phillippitts.consulttranslator.service.session.ConversationSessionRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    @Test
    void shouldReportOkWithActiveSessions() {
        ConversationSessionRegistry sessions = mock(ConversationSessionRegistry.class);
        when(sessions.activeCount()).thenReturn(3);

        ResponseEntity<Map<String, Object>> response = new HealthController(sessions).health();

        assertThat(response.getBody())
                .containsEntry("status", "ok")
                .containsEntry("activeSessions", 3)
                .containsKey("timestamp");
    }
}
