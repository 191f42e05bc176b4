package com.tony.propsAnalytics.model;

import java.util.Locale;

public enum Trend {
    HOT, COLD, NEUTRAL;

    public static Trend fromLabel(String label) {
        if (label == null) return NEUTRAL;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "hot" -> HOT;
            case "cold" -> COLD;
            default -> NEUTRAL;
        };
    }
}
