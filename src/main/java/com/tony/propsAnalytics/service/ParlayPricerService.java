package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.model.*;
import com.tony.propsAnalytics.util.OddsMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.util.Precision;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ParlayPricerService {

    private final CorrelationScorer correlationScorer;

    // Bornes du score de corrélation et de la décote SGP associée
    private static final int MIN_CORRELATION = -30;
    private static final int MAX_CORRELATION = 50;
    private static final double MIN_DISCOUNT_FACTOR = 0.65;
    private static final double DISCOUNT_FACTOR_RANGE = 0.30;

    /**
     * Cote combinée avec décote Same Game Parlay.
     * La décote ne s'applique qu'à la part "gain" de la cote, jamais à la mise.
     * Liste vide : cote décimale 1 (aucun gain), sans erreur. Le facteur reste celui d'une
     * corrélation nulle, mais la décote affichée est 0 % puisqu'il n'y a aucun gain à réduire.
     */
    public ParlayOdds combinedOdds(List<Leg> legs, double stake) {
        if (legs == null || legs.isEmpty()) {
            return new ParlayOdds(1.0, 1.0, 0, 0, discountFactor(0), 0.0, stake, stake, 0.0);
        }

        // 1. Prix naïf (jambes indépendantes)
        double baseDecimal = 1.0;
        for (Leg leg : legs) {
            baseDecimal *= OddsMath.americanToDecimal(leg.getRecommendedOdds());
        }

        // 2. Décote selon la corrélation
        int correlation = correlationScorer.score(legs);
        double factor = discountFactor(correlation);
        double adjustedDecimal = 1.0 + (baseDecimal - 1.0) * factor;

        // 3. Retour en cote américaine + gains
        int american = OddsMath.decimalToAmerican(adjustedDecimal);
        double payout = stake * adjustedDecimal;
        double profit = payout - stake;

        return new ParlayOdds(baseDecimal, adjustedDecimal, american, correlation,
                factor, (1.0 - factor) * 100.0, stake, payout, profit);
    }

    /** Plus corrélé => facteur plus petit => décote plus forte. Toujours dans [0.65, 0.95]. */
    public double discountFactor(int correlationScore) {
        int normalized = Math.max(MIN_CORRELATION, Math.min(MAX_CORRELATION, correlationScore));
        return MIN_DISCOUNT_FACTOR
                + ((double) (normalized - MIN_CORRELATION) / (MAX_CORRELATION - MIN_CORRELATION)) * DISCOUNT_FACTOR_RANGE;
    }

    /**
     * Probabilité combinée (en %) : produit des probabilités de chaque jambe sur son côté recommandé.
     * Indépendante de la décote, qui modélise le comportement du bookmaker et non la vraie probabilité jointe.
     */
    public double combinedProbability(List<Leg> legs) {
        if (legs == null || legs.isEmpty()) return 0.0;
        double probability = 1.0;
        for (Leg leg : legs) {
            probability *= leg.getRecommendedHitProbability();
        }
        return probability * 100.0;
    }

    public PricedParlay price(ParlayCandidate candidate, double stake) {
        ParlayOdds odds = combinedOdds(candidate.getLegs(), stake);
        double probabilityPct = combinedProbability(candidate.getLegs());
        double p = probabilityPct / 100.0;

        double expectedProfit = p * odds.profit() - (1.0 - p) * stake;
        double b = odds.decimal() - 1.0;
        double kelly = b > 0 ? Math.max(0.0, (b * p - (1.0 - p)) / b) : 0.0;

        ParlayVariant variant = candidate.getVariant();
        log.debug("{} : {} jambes, cote {} (décote {}%), proba {}%",
                variant.getId(), candidate.size(), OddsMath.formatAmerican(odds.american()),
                round(odds.discountPercent()), round(probabilityPct));

        return PricedParlay.builder()
                .id(variant.getId())
                .name(variant.getDisplayName())
                .description(variant.getDescription())
                .legs(candidate.getLegs())
                .risk(candidate.getRisk())
                .confidence(candidate.getConfidence())
                .reasoning(candidate.getReasoning())
                .baseDecimalOdds(round(odds.baseDecimal()))
                .decimalOdds(round(odds.decimal()))
                .americanOdds(odds.american())
                .americanOddsDisplay(OddsMath.formatAmerican(odds.american()))
                .discountPercent(round(odds.discountPercent()))
                .stake(stake)
                .payout(round(odds.payout()))
                .profit(round(odds.profit()))
                .combinedProbability(round(probabilityPct))
                .expectedProfit(round(expectedProfit))
                .kellyFraction(Precision.round(kelly, 4))
                .build();
    }

    private double round(double val) {
        return Precision.round(val, 2);
    }
}
