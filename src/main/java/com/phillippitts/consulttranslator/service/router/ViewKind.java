package com.phillippitts.consulttranslator.service.router;

/**
 * The three synchronized text views of a conversation.
 */
public enum ViewKind {
    /** Both parties as spoken, tagged by speaker, never translated. */
    ORIGINAL("original"),
    /** Everything rendered in the primary party's language. */
    PRIMARY("doctor"),
    /** Everything rendered in the secondary party's language. */
    SECONDARY("patient");

    private final String wireName;

    ViewKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Key used for this view in client messages and exported entries.
     */
    public String wireName() {
        return wireName;
    }
}
