package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.domain.Token;
import com.phillippitts.consulttranslator.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationRouterFactoryTest {

    @Test
    void shouldFallBackToDefaultLanguagesForBlankValues() {
        ConversationRouterFactory factory = new ConversationRouterFactory(RouterSettings.DEFAULT, "en", "te", false);

        ConversationRouter router = factory.create(null, "  ");

        assertThat(router.primaryLanguage()).isEqualTo("en");
        assertThat(router.secondaryLanguage()).isEqualTo("te");
        assertThat(router.mode()).isEqualTo(RoutingMode.TRANSLATION);
    }

    @Test
    void shouldCreateIndependentRouters() {
        ConversationRouterFactory factory = new ConversationRouterFactory(RouterSettings.DEFAULT, "en", "te", false);

        ConversationRouter first = factory.createDefault();
        ConversationRouter second = factory.create("hi", "en");
        first.processToken(Token.of("Hello.", "A", "en", true));

        assertThat(first).isNotSameAs(second);
        assertThat(first.hasContent()).isTrue();
        assertThat(second.hasContent()).isFalse();
        assertThat(second.primaryLanguage()).isEqualTo("hi");
    }

    @Test
    void shouldAllowSameLanguageUnlessTranslationRequired() {
        ConversationRouterFactory lenient = new ConversationRouterFactory(RouterSettings.DEFAULT, "en", "te", false);
        ConversationRouterFactory strict = new ConversationRouterFactory(RouterSettings.DEFAULT, "en", "te", true);

        assertThat(lenient.create("en", "en").mode()).isEqualTo(RoutingMode.SAME_LANGUAGE);
        assertThatThrownBy(() -> strict.create("en", "EN"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("must differ");
    }
}
