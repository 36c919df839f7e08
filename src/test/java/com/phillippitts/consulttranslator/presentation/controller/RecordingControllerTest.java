package com.phillippitts.consulttranslator.presentation.controller;

import com.phillippitts.consulttranslator.exception.RecordingNotFoundException;
import com.phillippitts.consulttranslator.service.recording.ConversationRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecordingControllerTest {

    private ConversationRecorder recorder;
    private RecordingController controller;

    @BeforeEach
    void setUp() {
        recorder = mock(ConversationRecorder.class);
        controller = new RecordingController(recorder);
    }

    @Test
    void shouldListRecordingsWithCount() {
        when(recorder.list()).thenReturn(List.of("Doc-patient-EN_10192026_14_05.json", "Doc-patient-TE_10192026_14_05.json"));

        ResponseEntity<Map<String, Object>> response = controller.list();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("count", 2);
        assertThat((List<?>) response.getBody().get("recordings")).hasSize(2);
    }

    @Test
    void shouldReturnRawRecordingAsJson() {
        when(recorder.load("Doc-patient-EN_10192026_14_05.json")).thenReturn("{\"type\":\"doctor_view\"}");

        ResponseEntity<String> response = controller.get("Doc-patient-EN_10192026_14_05.json");

        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(response.getBody()).isEqualTo("{\"type\":\"doctor_view\"}");
    }

    @Test
    void shouldLetMissingRecordingReachExceptionHandler() {
        when(recorder.load("missing.json")).thenThrow(new RecordingNotFoundException("missing.json"));

        assertThatThrownBy(() -> controller.get("missing.json"))
                .isInstanceOf(RecordingNotFoundException.class);
    }
}
