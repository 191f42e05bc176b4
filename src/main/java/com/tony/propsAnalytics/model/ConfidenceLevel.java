package com.tony.propsAnalytics.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum ConfidenceLevel {
    LOW(0.70),
    MEDIUM(0.85),
    HIGH(1.0);

    // Pondération de la note de base
    private final double gradeMultiplier;

    /** Absent ou illisible : LOW (le modèle n'a pas assez d'historique). */
    public static ConfidenceLevel fromLabel(String label) {
        if (label == null || label.isBlank()) return LOW;
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}
