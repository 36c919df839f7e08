package com.phillippitts.consulttranslator.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the live conversation WebSocket endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "translator.websocket")
public class WebSocketProperties {

    @NotBlank
    private final String path;

    @NotEmpty
    private final List<String> allowedOrigins;

    @ConstructorBinding
    public WebSocketProperties(String path, List<String> allowedOrigins) {
        this.path = path == null ? "/ws" : path;
        this.allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty()
                ? List.of("*")
                : List.copyOf(allowedOrigins);
    }

    public String getPath() {
        return path;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }
}
