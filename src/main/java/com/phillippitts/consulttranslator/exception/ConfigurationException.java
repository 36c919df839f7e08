package com.phillippitts.consulttranslator.exception;

/**
 * Thrown when a session is configured with an unusable language pair: a blank language,
 * or two equal languages where translation is required.
 */
public class ConfigurationException extends TranslatorException {

    private final String primaryLanguage;
    private final String secondaryLanguage;

    public ConfigurationException(String message, String primaryLanguage, String secondaryLanguage) {
        super(message + " (primary: " + primaryLanguage + ", secondary: " + secondaryLanguage + ")");
        this.primaryLanguage = primaryLanguage;
        this.secondaryLanguage = secondaryLanguage;
    }

    public String getPrimaryLanguage() {
        return primaryLanguage;
    }

    public String getSecondaryLanguage() {
        return secondaryLanguage;
    }
}
