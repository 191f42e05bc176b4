package com.tony.propsAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PricedParlay {
    String id;
    String name;
    String description;
    List<Leg> legs;
    RiskLevel risk;
    ParlayConfidence confidence;
    String reasoning;

    // Tarification
    double baseDecimalOdds;
    double decimalOdds;
    int americanOdds;
    String americanOddsDisplay;
    double discountPercent;
    double stake;
    double payout;
    double profit;

    // Probabilités & valeur
    double combinedProbability; // en %
    double expectedProfit;
    double kellyFraction;
}
