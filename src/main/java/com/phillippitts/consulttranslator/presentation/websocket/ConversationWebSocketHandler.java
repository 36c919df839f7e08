package com.phillippitts.consulttranslator.presentation.websocket;

import com.phillippitts.consulttranslator.domain.Token;
import com.phillippitts.consulttranslator.domain.TokenOutcome;
import com.phillippitts.consulttranslator.domain.ViewSnapshot;
import com.phillippitts.consulttranslator.exception.ConfigurationException;
import com.phillippitts.consulttranslator.service.events.ConversationEndedEvent;
import com.phillippitts.consulttranslator.service.events.RecognizerErrorEvent;
import com.phillippitts.consulttranslator.service.ingest.RecognizerMessage;
import com.phillippitts.consulttranslator.service.ingest.RecognizerMessageParser;
import com.phillippitts.consulttranslator.service.metrics.ConversationMetrics;
import com.phillippitts.consulttranslator.service.router.ConversationRouter;
import com.phillippitts.consulttranslator.service.session.ConversationSessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Live conversation endpoint.
 *
 * <p>Protocol per connection:
 * <ol>
 *   <li>The first text message configures the session:
 *       {@code {"doctor_lang": "en", "patient_lang": "te"}}. The server answers with
 *       {@code {"status": "connected", ...}}, or with {@code {"error": ...}} and closes.</li>
 *   <li>Every further text message is a recognizer result. Each routed token is answered with
 *       {@code {"type": "partial|final", "text", "is_final", "speaker", "partials", "boxes"}}.</li>
 *   <li>On close the conversation is handed to listeners as a {@link ConversationEndedEvent}.</li>
 * </ol>
 *
 * <p>Each router is only touched while holding its session's lock, so tokens are routed in
 * arrival order even if a container dispatches a session's frames on different threads.
 */
@Component
public class ConversationWebSocketHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(ConversationWebSocketHandler.class);

    static final String CONVERSATION_ID_KEY = "conversationId";

    private final ConversationSessionRegistry sessions;
    private final ConversationMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public ConversationWebSocketHandler(ConversationSessionRegistry sessions,
                                        ConversationMetrics metrics,
                                        ApplicationEventPublisher publisher) {
        this.sessions = sessions;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        ThreadContext.put(CONVERSATION_ID_KEY, session.getId());
        try {
            LOG.info("Connection established: remote={}", session.getRemoteAddress());
        } finally {
            ThreadContext.remove(CONVERSATION_ID_KEY);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        ThreadContext.put(CONVERSATION_ID_KEY, session.getId());
        try {
            synchronized (session) {
                Optional<ConversationRouter> router = sessions.find(session.getId());
                if (router.isEmpty()) {
                    configure(session, message.getPayload());
                } else {
                    route(session, router.get(), message.getPayload());
                }
            }
        } finally {
            ThreadContext.remove(CONVERSATION_ID_KEY);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ThreadContext.put(CONVERSATION_ID_KEY, session.getId());
        try {
            LOG.warn("Transport error: {}", exception.getMessage(), exception);
        } finally {
            ThreadContext.remove(CONVERSATION_ID_KEY);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ThreadContext.put(CONVERSATION_ID_KEY, session.getId());
        try {
            LOG.info("Connection closed: status={}", status);
            Optional<ConversationRouter> router;
            synchronized (session) {
                router = sessions.close(session.getId());
            }
            router.ifPresent(r -> publisher.publishEvent(
                    new ConversationEndedEvent(r.transcript(session.getId()), Instant.now())));
        } finally {
            ThreadContext.remove(CONVERSATION_ID_KEY);
        }
    }

    private void configure(WebSocketSession session, String payload) throws IOException {
        String primary;
        String secondary;
        try {
            JSONObject config = new JSONObject(payload);
            primary = config.optString("doctor_lang", null);
            secondary = config.optString("patient_lang", null);
        } catch (JSONException e) {
            LOG.warn("Rejected malformed session configuration: {}", e.getMessage());
            send(session, new JSONObject().put("error", "Invalid configuration message"));
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        ConversationRouter router;
        try {
            router = sessions.open(session.getId(), primary, secondary);
        } catch (ConfigurationException e) {
            LOG.warn("Rejected session configuration: {}", e.getMessage());
            send(session, new JSONObject().put("error", e.getMessage()));
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        send(session, new JSONObject()
                .put("status", "connected")
                .put("message", "Conversation configured")
                .put("mode", router.mode().name().toLowerCase(Locale.ROOT))
                .put("languages", new JSONObject()
                        .put("doctor", router.primaryLanguage())
                        .put("patient", router.secondaryLanguage())));
    }

    private void route(WebSocketSession session, ConversationRouter router, String payload) throws IOException {
        long start = System.nanoTime();
        RecognizerMessage message = RecognizerMessageParser.parse(payload);

        if (message.isError()) {
            metrics.incrementRecognizerErrors(message.errorCode());
            publisher.publishEvent(new RecognizerErrorEvent(
                    session.getId(), message.errorCode(), message.errorMessage(), Instant.now()));
            send(session, new JSONObject()
                    .put("error", String.valueOf(message.errorMessage()))
                    .put("error_code", message.errorCode()));
            return;
        }

        for (Token token : message.tokens()) {
            TokenOutcome outcome = router.processToken(token);
            if (outcome.isDropped()) {
                metrics.incrementTokens("dropped");
                continue;
            }
            metrics.incrementTokens(outcome.isFinal() ? "final" : "partial");
            send(session, reply(token, outcome, router));
        }

        if (message.finished()) {
            LOG.info("Recognizer signalled end of stream");
        }
        metrics.recordMessageLatency(System.nanoTime() - start);
    }

    static JSONObject reply(Token token, TokenOutcome outcome, ConversationRouter router) {
        ViewSnapshot boxes = outcome.snapshot().orElseGet(router::snapshot);
        return new JSONObject()
                .put("type", outcome.isFinal() ? "final" : "partial")
                .put("text", token.text().strip())
                .put("is_final", outcome.isFinal())
                .put("speaker", outcome.speaker())
                .put("partials", outcome.latestPartialsBySpeaker())
                .put("boxes", new JSONObject()
                        .put("original", boxes.original())
                        .put("doctor", boxes.primary())
                        .put("patient", boxes.secondary()));
    }

    private static void send(WebSocketSession session, JSONObject body) throws IOException {
        if (session.isOpen()) {
            session.sendMessage(new TextMessage(body.toString()));
        }
    }
}
