package com.phillippitts.consulttranslator.config.router;

import com.phillippitts.consulttranslator.config.properties.RouterProperties;
import com.phillippitts.consulttranslator.service.router.ConversationRouterFactory;
import com.phillippitts.consulttranslator.service.router.RouterSettings;
import com.phillippitts.consulttranslator.service.router.SpeakerLabels;
import com.phillippitts.consulttranslator.service.router.TextMerger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the routing core from {@link RouterProperties}. Routers themselves are not beans:
 * every conversation gets its own instance from the factory.
 */
@Configuration
public class RouterConfig {

    @Bean
    public RouterSettings routerSettings(RouterProperties props) {
        return new RouterSettings(
                new SpeakerLabels(props.getPrimaryLabel(), props.getSecondaryLabel()),
                new TextMerger(props.getContinuationFragments()),
                props.getDisplayWindow(),
                props.getPlaceholder());
    }

    @Bean
    public ConversationRouterFactory conversationRouterFactory(RouterSettings settings, RouterProperties props) {
        return new ConversationRouterFactory(settings,
                props.getPrimaryLanguage(),
                props.getSecondaryLanguage(),
                props.isTranslationRequired());
    }
}
