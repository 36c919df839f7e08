package com.phillippitts.consulttranslator;

import com.phillippitts.consulttranslator.config.properties.RecordingProperties;
import com.phillippitts.consulttranslator.config.properties.RouterProperties;
import com.phillippitts.consulttranslator.config.properties.WebSocketProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RouterProperties.class,
        RecordingProperties.class,
        WebSocketProperties.class
})
public class ConsultTranslatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConsultTranslatorApplication.class, args);
    }

}
