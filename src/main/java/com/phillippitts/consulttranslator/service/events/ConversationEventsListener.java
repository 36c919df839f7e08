package com.phillippitts.consulttranslator.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs upstream recognizer errors, throttled per error code to avoid log spam from a
 * recognizer that repeats the same failure on every message.
 */
@Component
class ConversationEventsListener {
    private static final Logger LOG = LogManager.getLogger(ConversationEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onRecognizerError(RecognizerErrorEvent e) {
        if (shouldLog("recognizer-" + e.errorCode())) {
            LOG.warn("Recognizer error: conversation={}, code={}, message={}",
                    e.conversationId(), e.errorCode(), e.errorMessage());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
