package com.tony.propsAnalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum ParlayConfidence {
    HIGH("High"),
    MEDIUM_HIGH("Medium-High"),
    MEDIUM("Medium");

    private final String label;

    @JsonValue
    public String getLabel() {
        return label;
    }
}
