package com.tony.propsAnalytics.model;

import java.util.List;

public record GradeResult(double grade, GradeTier tier, List<String> factors) {

    public GradeResult {
        factors = List.copyOf(factors);
    }

    public static GradeResult of(double grade, List<String> factors) {
        return new GradeResult(grade, GradeTier.of(grade), factors);
    }
}
