package com.tony.propsAnalytics.model.dto;

public record OddsConversion(int american, double decimal, double impliedProbability) {}
