package com.atmosight.core.model;

import java.util.Locale;

/**
 * Sign of a fitted trend slope.
 *
 * @since 1.0.0
 */
public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    public static TrendDirection ofSlope(double slope) {
        if (slope > 0) {
            return INCREASING;
        }
        if (slope < 0) {
            return DECREASING;
        }
        return STABLE;
    }

    /** @return lowercase label used in narrative text, e.g. {@code increasing} */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
