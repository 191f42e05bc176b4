package com.tony.propsAnalytics.model;

import lombok.RequiredArgsConstructor;

/**
 * Paliers d'affichage de la note (0-1).
 */
@RequiredArgsConstructor
public enum GradeTier {
    STRONG(0.70),
    SOLID(0.50),
    LEAN(0.30),
    WEAK(0.0);

    private final double threshold;

    public static GradeTier of(double grade) {
        for (GradeTier tier : values()) {
            if (grade >= tier.threshold) return tier;
        }
        return WEAK;
    }
}
