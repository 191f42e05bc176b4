package com.tony.propsAnalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Une prop appariée à sa prédiction : candidate pour entrer dans un parlay.
 * Immuable ; la notation produit une nouvelle instance via {@link #withGrade(GradeResult)}.
 */
@Value
@Builder(toBuilder = true)
public class Leg {
    String playerId;
    String playerName;
    String teamId;
    TeamSide venue;
    StatType statType;

    double line;
    int overOdds;
    int underOdds;

    double predictedValue;
    double edge;
    ConfidenceLevel confidence;
    Trend trend;

    RecommendedSide recommendedSide;
    int recommendedOdds;
    double overHitProbability;
    double underHitProbability;

    double grade;
    GradeTier gradeTier;
    @Builder.Default
    List<String> gradeFactors = List.of();

    /** Clé d'unicité dans un parlay : un joueur ne peut apparaître qu'une fois par stat. */
    @JsonIgnore
    public String getKey() {
        return playerId + "-" + statType;
    }

    @JsonIgnore
    public double getStrength() {
        return Math.abs(edge);
    }

    @JsonIgnore
    public boolean isPush() {
        return recommendedSide == RecommendedSide.PUSH;
    }

    /** Probabilité de réussite du côté recommandé. */
    @JsonIgnore
    public double getRecommendedHitProbability() {
        return recommendedSide == RecommendedSide.UNDER ? underHitProbability : overHitProbability;
    }

    public Leg withGrade(GradeResult result) {
        return toBuilder()
                .grade(result.grade())
                .gradeTier(result.tier())
                .gradeFactors(result.factors())
                .build();
    }
}
