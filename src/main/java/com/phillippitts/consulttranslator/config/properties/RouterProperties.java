package com.phillippitts.consulttranslator.config.properties;

import com.phillippitts.consulttranslator.service.router.RouterSettings;
import com.phillippitts.consulttranslator.service.router.TextMerger;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for conversation routing.
 */
@Validated
@ConfigurationProperties(prefix = "translator.router")
public class RouterProperties {

    /** Language of the primary party (doctor) when the client does not choose one. */
    @NotBlank
    private final String primaryLanguage;

    /** Language of the secondary party (patient) when the client does not choose one. */
    @NotBlank
    private final String secondaryLanguage;

    @NotBlank
    private final String primaryLabel;

    @NotBlank
    private final String secondaryLabel;

    /** Trailing characters of each view sent to clients. */
    @Min(1)
    private final int displayWindow;

    @NotNull
    private final String placeholder;

    /** Short fragments merged onto the previous word without a space. */
    @NotNull
    private final List<String> continuationFragments;

    /**
     * Reject sessions whose two languages are equal. When false, equal languages select
     * same-language mode, where views are split by speaker only.
     */
    private final boolean translationRequired;

    @ConstructorBinding
    public RouterProperties(String primaryLanguage, String secondaryLanguage,
                            String primaryLabel, String secondaryLabel,
                            Integer displayWindow, String placeholder,
                            List<String> continuationFragments, Boolean translationRequired) {
        this.primaryLanguage = primaryLanguage == null ? "en" : primaryLanguage;
        this.secondaryLanguage = secondaryLanguage == null ? "te" : secondaryLanguage;
        this.primaryLabel = primaryLabel == null ? "Doctor" : primaryLabel;
        this.secondaryLabel = secondaryLabel == null ? "Patient" : secondaryLabel;
        this.displayWindow = displayWindow == null ? RouterSettings.DEFAULT_DISPLAY_WINDOW : displayWindow;
        this.placeholder = placeholder == null ? RouterSettings.DEFAULT_PLACEHOLDER : placeholder;
        this.continuationFragments = continuationFragments == null
                ? TextMerger.DEFAULT_CONTINUATION_FRAGMENTS
                : List.copyOf(continuationFragments);
        this.translationRequired = translationRequired != null && translationRequired;
    }

    /**
     * Defaults for tests and manual instantiation.
     */
    public RouterProperties() {
        this(null, null, null, null, null, null, null, null);
    }

    public String getPrimaryLanguage() {
        return primaryLanguage;
    }

    public String getSecondaryLanguage() {
        return secondaryLanguage;
    }

    public String getPrimaryLabel() {
        return primaryLabel;
    }

    public String getSecondaryLabel() {
        return secondaryLabel;
    }

    public int getDisplayWindow() {
        return displayWindow;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public List<String> getContinuationFragments() {
        return continuationFragments;
    }

    public boolean isTranslationRequired() {
        return translationRequired;
    }
}
