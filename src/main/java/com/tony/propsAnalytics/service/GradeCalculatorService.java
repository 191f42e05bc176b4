package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.model.*;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
public class GradeCalculatorService {

    private static final double EDGE_SCALE = 10.0;

    private static final double INJURY_BOOST_PER_PLAYER = 0.08;
    private static final double MAX_INJURY_BOOST = 0.20;
    private static final double HOME_COURT_BOOST = 0.05;

    private static final double HIGH_PACE_TOTAL = 230.0;
    private static final double ABOVE_AVERAGE_PACE_TOTAL = 220.0;
    private static final double LOW_PACE_TOTAL = 210.0;

    private static final double CLOSE_GAME_SPREAD = 5.0;
    private static final double BLOWOUT_SPREAD = 12.0;

    private static final double TREND_BOOST = 0.05;

    /**
     * Note de qualité du pick (0 à 1) : modèle additif.
     * Base (edge x confiance) + blessures + domicile + rythme + écart attendu + tendance.
     * Un contexte absent ne contribue simplement pas.
     */
    public GradeResult grade(Leg leg, ContextSignals context) {
        ContextSignals ctx = context == null ? ContextSignals.empty() : context;
        List<String> factors = new ArrayList<>();

        double base = calculateBaseGrade(leg);
        double injuryBoost = calculateInjuryBoost(leg, ctx, factors);
        double locationBoost = calculateLocationBoost(leg, factors);
        double paceBoost = calculatePaceBoost(leg, ctx, factors);
        double competitiveBoost = calculateCompetitiveBoost(leg, ctx, factors);
        double trendBoost = calculateTrendBoost(leg, factors);

        double total = base + injuryBoost + locationBoost + paceBoost + competitiveBoost + trendBoost;
        return GradeResult.of(Math.max(0.0, Math.min(1.0, total)), factors);
    }

    public Leg applyGrade(Leg leg, ContextSignals context) {
        return leg.withGrade(grade(leg, context));
    }

    private double calculateBaseGrade(Leg leg) {
        ConfidenceLevel confidence = leg.getConfidence() != null ? leg.getConfidence() : ConfidenceLevel.LOW;
        return Math.min(Math.abs(leg.getEdge()) / EDGE_SCALE, 1.0) * confidence.getGradeMultiplier();
    }

    // Facteur 1 : coéquipiers forfaits (plus de volume pour le joueur)
    private double calculateInjuryBoost(Leg leg, ContextSignals ctx, List<String> factors) {
        long significant = ctx.injuriesOf(leg.getTeamId()).stream()
                .filter(i -> !Objects.equals(i.athleteId(), leg.getPlayerId()))
                .filter(InjuryReport::isOut)
                .filter(InjuryReport::hasPrimaryPosition)
                .count();
        if (significant == 0) return 0.0;

        double boost = Math.min(significant * INJURY_BOOST_PER_PLAYER, MAX_INJURY_BOOST);
        factors.add(String.format("+%d%% coéquipiers blessés (%d)", percent(boost), significant));
        return boost;
    }

    // Facteur 2 : avantage du terrain, seulement pour un over
    private double calculateLocationBoost(Leg leg, List<String> factors) {
        if (leg.getVenue() == TeamSide.HOME && leg.getEdge() > 0) {
            factors.add("+5% avantage du terrain");
            return HOME_COURT_BOOST;
        }
        return 0.0;
    }

    // Facteur 3 : rythme du match via le total O/U
    private double calculatePaceBoost(Leg leg, ContextSignals ctx, List<String> factors) {
        Double overUnder = ctx.getOverUnder();
        StatType stat = leg.getStatType();
        if (overUnder == null || stat == null) return 0.0;

        double boost = 0.0;
        String factor = null;

        if (stat.isScoringType()) {
            if (overUnder >= HIGH_PACE_TOTAL) {
                boost = 0.08;
                factor = "+8% match à haut rythme (O/U 230+)";
            } else if (overUnder >= ABOVE_AVERAGE_PACE_TOTAL) {
                boost = 0.05;
                factor = "+5% rythme au-dessus de la moyenne (O/U 220+)";
            } else if (overUnder < LOW_PACE_TOTAL) {
                boost = -0.05;
                factor = "-5% match lent (O/U <210)";
            }
        }

        // Un match lent favorise rebonds et contres : prime sur la règle offensive
        if (stat.isDefensiveCountType() && overUnder < LOW_PACE_TOTAL) {
            boost = 0.05;
            factor = "+5% match défensif (O/U <210)";
        }

        if (factor != null) factors.add(factor);
        return boost;
    }

    // Facteur 4 : écart attendu (match serré = plus de minutes, blowout = moins pour l'outsider)
    private double calculateCompetitiveBoost(Leg leg, ContextSignals ctx, List<String> factors) {
        if (ctx.getSpread() == null) return 0.0;
        double spread = Math.abs(ctx.getSpread());

        if (spread <= CLOSE_GAME_SPREAD) {
            factors.add("+6% match serré attendu (plus de minutes)");
            return 0.06;
        }
        if (spread > BLOWOUT_SPREAD && ctx.isUnderdog(leg.getVenue())) {
            factors.add("-8% risque de blowout (minutes réduites)");
            return -0.08;
        }
        return 0.0;
    }

    // Facteur 5 : forme récente
    private double calculateTrendBoost(Leg leg, List<String> factors) {
        if (leg.getTrend() == Trend.HOT) {
            factors.add("+5% joueur en forme");
            return TREND_BOOST;
        }
        if (leg.getTrend() == Trend.COLD) {
            factors.add("-5% joueur en méforme");
            return -TREND_BOOST;
        }
        return 0.0;
    }

    private long percent(double value) {
        return Math.round(value * 100.0);
    }
}
