package io.memframe.core;

/**
 * Outcome of an NA-aware comparison.
 * <p>
 * Comparing NA with anything, NA included, is {@link #UNKNOWN}. Conjunction
 * follows Kleene logic: a definite {@link #FALSE} wins over {@link #UNKNOWN},
 * which wins over {@link #TRUE}.
 */
public enum Ternary {
    TRUE,
    FALSE,
    UNKNOWN;

    public static Ternary of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public Ternary and(Ternary other) {
        if (this == FALSE || other == FALSE) {
            return FALSE;
        }
        if (this == UNKNOWN || other == UNKNOWN) {
            return UNKNOWN;
        }
        return TRUE;
    }

    public Ternary not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    /**
     * True only for {@link #TRUE}; {@link #UNKNOWN} is falsy.
     */
    public boolean isTrue() {
        return this == TRUE;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }
}
