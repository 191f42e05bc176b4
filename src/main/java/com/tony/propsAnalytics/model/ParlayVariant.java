package com.tony.propsAnalytics.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Les formats de parlay proposés pour un match, du plus prudent au plus agressif.
 */
@Getter
@RequiredArgsConstructor
public enum ParlayVariant {
    SAFE_TWO_LEG("2leg-safe", "Safe 2-Leg Parlay", "Les picks les plus sûrs", 2, true,
            RiskLevel.LOW, ParlayConfidence.HIGH),
    BALANCED_THREE_LEG("3leg-balanced", "Balanced 3-Leg Parlay", "Bon équilibre entre cote et sécurité", 3, true,
            RiskLevel.MEDIUM, ParlayConfidence.MEDIUM_HIGH),
    AGGRESSIVE_FOUR_LEG("4leg-aggro", "Aggressive 4-Leg Parlay", "Gain plus élevé, risque plus élevé", 4, true,
            RiskLevel.HIGH, ParlayConfidence.MEDIUM),
    VALUE_PLAY("value-play", "Value Play", "Les meilleurs edges face aux lignes Vegas", 3, false,
            RiskLevel.MEDIUM, ParlayConfidence.HIGH);

    private final String id;
    private final String displayName;
    private final String description;
    private final int size;
    private final boolean diversified;
    private final RiskLevel risk;
    private final ParlayConfidence confidence;

    /** Nombre minimal de jambes pour émettre la variante. */
    public int minimumLegs() {
        return this == VALUE_PLAY ? 2 : size;
    }
}
