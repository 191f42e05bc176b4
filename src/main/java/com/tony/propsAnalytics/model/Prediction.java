package com.tony.propsAnalytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Prediction {
    String playerId;
    StatType statType;
    double predictedValue;
    Double edge; // prédiction - ligne ; recalculé si absent
    @Builder.Default
    ConfidenceLevel confidence = ConfidenceLevel.LOW;
    @Builder.Default
    Trend trend = Trend.NEUTRAL;

    public double edgeAgainst(double line) {
        return edge != null ? edge : predictedValue - line;
    }
}
