package com.example.demo.lettergen.model;

import java.util.Locale;

/**
 * Two-valued state of a conditional binding. Templates compare against the literal
 * {@code 'sí'}; anything that is not an affirmative answer counts as {@link #NO}.
 */
public enum ConditionalState {
    YES("sí"),
    NO("no");

    private final String text;

    ConditionalState(String text) {
        this.text = text;
    }

    /**
     * Literal used in templates and in the merged variable map.
     */
    public String getText() {
        return text;
    }

    public boolean isYes() {
        return this == YES;
    }

    /**
     * Accepts "sí", "si", "SI", "SÍ" and "1" as {@link #YES}; everything else,
     * null and blank included, is {@link #NO}.
     */
    public static ConditionalState parse(String value) {
        if (value == null) {
            return NO;
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.equals("SI") || v.equals("SÍ") || v.equals("1")) {
            return YES;
        }
        return NO;
    }
}
