package com.glyphforge.api.model;

import java.util.Locale;

/**
 * Rule verbs understood by the matcher.
 */
public enum RuleCommand {
    /** Passes if any of the rule's literals occurs in the component text. */
    TAG,
    /** Passes if the rule's regular expression finds a match; the match is extracted. */
    PLUCK;

    public static RuleCommand fromString(String value) {
        try {
            return valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rule command: " + value, e);
        }
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
