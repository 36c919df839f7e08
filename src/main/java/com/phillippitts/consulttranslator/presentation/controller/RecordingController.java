package com.phillippitts.consulttranslator.presentation.controller;

import com.phillippitts.consulttranslator.service.recording.ConversationRecorder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read access to saved conversations.
 */
@RestController
class RecordingController {

    private static final Logger LOG = LogManager.getLogger(RecordingController.class);

    private final ConversationRecorder recorder;

    RecordingController(ConversationRecorder recorder) {
        this.recorder = recorder;
    }

    @GetMapping("/recordings")
    ResponseEntity<Map<String, Object>> list() {
        List<String> recordings = recorder.list();
        LOG.debug("Listing {} recordings", recordings.size());
        return ResponseEntity.ok(Map.of(
                "count", recordings.size(),
                "recordings", recordings
        ));
    }

    @GetMapping("/recordings/{name}")
    ResponseEntity<String> get(@PathVariable("name") String name) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(recorder.load(name));
    }
}
