package com.phillippitts.consulttranslator.service.recording;

import com.phillippitts.consulttranslator.config.properties.RecordingProperties;
import com.phillippitts.consulttranslator.domain.ConversationTranscript;
import com.phillippitts.consulttranslator.exception.RecordingException;
import com.phillippitts.consulttranslator.service.events.ConversationEndedEvent;
import com.phillippitts.consulttranslator.service.metrics.ConversationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Saves each finished conversation that produced any Original text. */
@Component
class ConversationRecordingListener {
    private static final Logger LOG = LogManager.getLogger(ConversationRecordingListener.class);

    private final ConversationRecorder recorder;
    private final RecordingProperties props;
    private final ConversationMetrics metrics;

    ConversationRecordingListener(ConversationRecorder recorder, RecordingProperties props,
                                  ConversationMetrics metrics) {
        this.recorder = recorder;
        this.props = props;
        this.metrics = metrics;
    }

    @EventListener
    void onConversationEnded(ConversationEndedEvent e) {
        ConversationTranscript transcript = e.transcript();
        if (!props.isEnabled()) {
            LOG.debug("Recording disabled; conversation {} not saved", transcript.conversationId());
            return;
        }
        if (!transcript.hasContent()) {
            LOG.debug("Conversation {} has no content; nothing to save", transcript.conversationId());
            return;
        }
        try {
            recorder.save(transcript);
            metrics.incrementRecordingsSaved();
        } catch (RecordingException ex) {
            LOG.error("Failed to save conversation {}: path={}", transcript.conversationId(), ex.getPath(), ex);
        }
    }
}
