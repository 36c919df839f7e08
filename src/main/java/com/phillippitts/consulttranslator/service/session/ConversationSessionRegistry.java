package com.phillippitts.consulttranslator.service.session;

import com.phillippitts.consulttranslator.exception.ConfigurationException;
import com.phillippitts.consulttranslator.service.metrics.ConversationMetrics;
import com.phillippitts.consulttranslator.service.router.ConversationRouter;
import com.phillippitts.consulttranslator.service.router.ConversationRouterFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link ConversationRouter} per live session.
 *
 * <p>The map itself is thread-safe; each router is not, so callers must feed a router from one
 * thread at a time (the WebSocket transport delivers a session's messages sequentially).
 */
@Component
public class ConversationSessionRegistry {

    private static final Logger LOG = LogManager.getLogger(ConversationSessionRegistry.class);

    private final ConversationRouterFactory factory;
    private final Map<String, ConversationRouter> sessions = new ConcurrentHashMap<>();

    public ConversationSessionRegistry(ConversationRouterFactory factory, ConversationMetrics metrics) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
        metrics.bindActiveSessions(sessions::size);
    }

    /**
     * Starts a conversation for a session, replacing any router it already had.
     *
     * @param sessionId         transport session identifier
     * @param primaryLanguage   primary party's language (blank uses the default)
     * @param secondaryLanguage secondary party's language (blank uses the default)
     * @return the new router
     * @throws ConfigurationException if the language pair is rejected
     */
    public ConversationRouter open(String sessionId, String primaryLanguage, String secondaryLanguage) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        ConversationRouter router = factory.create(primaryLanguage, secondaryLanguage);
        ConversationRouter previous = sessions.put(sessionId, router);
        if (previous != null) {
            LOG.warn("Session {} reconfigured; previous conversation discarded", sessionId);
        }
        LOG.info("Session {} opened: primary={}, secondary={}, mode={}",
                sessionId, router.primaryLanguage(), router.secondaryLanguage(), router.mode());
        return router;
    }

    public Optional<ConversationRouter> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Removes a session's router.
     *
     * @return the removed router, or empty if the session never configured one
     */
    public Optional<ConversationRouter> close(String sessionId) {
        ConversationRouter removed = sessions.remove(sessionId);
        if (removed != null) {
            LOG.info("Session {} closed", sessionId);
        }
        return Optional.ofNullable(removed);
    }

    public int activeCount() {
        return sessions.size();
    }
}
