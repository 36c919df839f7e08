package com.phillippitts.consulttranslator.service.router;

import com.phillippitts.consulttranslator.exception.ConfigurationException;

import java.util.Objects;

/**
 * Creates one independent {@link ConversationRouter} per conversation session.
 *
 * <p>The factory itself is stateless apart from immutable settings and can be shared.
 */
public class ConversationRouterFactory {

    private final RouterSettings settings;
    private final String defaultPrimaryLanguage;
    private final String defaultSecondaryLanguage;
    private final boolean translationRequired;

    public ConversationRouterFactory(RouterSettings settings,
                                     String defaultPrimaryLanguage,
                                     String defaultSecondaryLanguage,
                                     boolean translationRequired) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.defaultPrimaryLanguage = Objects.requireNonNull(defaultPrimaryLanguage, "defaultPrimaryLanguage must not be null");
        this.defaultSecondaryLanguage = Objects.requireNonNull(defaultSecondaryLanguage, "defaultSecondaryLanguage must not be null");
        this.translationRequired = translationRequired;
    }

    /**
     * Creates a router for a language pair, falling back to the defaults for blank values.
     *
     * @throws ConfigurationException if the resulting pair is rejected
     */
    public ConversationRouter create(String primaryLanguage, String secondaryLanguage) {
        String primary = primaryLanguage == null || primaryLanguage.isBlank() ? defaultPrimaryLanguage : primaryLanguage;
        String secondary = secondaryLanguage == null || secondaryLanguage.isBlank() ? defaultSecondaryLanguage : secondaryLanguage;
        return new ConversationRouter(settings, primary, secondary, translationRequired);
    }

    /**
     * Creates a router for the default language pair.
     */
    public ConversationRouter createDefault() {
        return create(defaultPrimaryLanguage, defaultSecondaryLanguage);
    }

    public RouterSettings settings() {
        return settings;
    }
}
