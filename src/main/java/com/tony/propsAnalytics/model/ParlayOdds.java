package com.tony.propsAnalytics.model;

/**
 * Cote combinée d'un parlay après décote SGP.
 * {@code discountFactor} est toujours dans [0.65, 0.95], y compris pour un parlay vide.
 */
public record ParlayOdds(double baseDecimal,
                         double decimal,
                         int american,
                         int correlationScore,
                         double discountFactor,
                         double discountPercent,
                         double stake,
                         double payout,
                         double profit) {}
