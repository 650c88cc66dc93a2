package com.smarttodo.enums;

import java.util.Locale;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    /**
     * Lenient lookup used on model output; anything unrecognised is neutral.
     */
    public static Sentiment parse(String value) {
        if (value == null) {
            return NEUTRAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NEUTRAL;
        }
    }
}
