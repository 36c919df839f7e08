package com.phillippitts.consulttranslator.config.websocket;

import com.phillippitts.consulttranslator.config.properties.WebSocketProperties;
import com.phillippitts.consulttranslator.presentation.websocket.ConversationWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the live conversation endpoint.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ConversationWebSocketHandler handler;
    private final WebSocketProperties props;

    public WebSocketConfig(ConversationWebSocketHandler handler, WebSocketProperties props) {
        this.handler = handler;
        this.props = props;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, props.getPath())
                .setAllowedOriginPatterns(props.getAllowedOrigins().toArray(String[]::new));
    }
}
