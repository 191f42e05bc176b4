package com.tony.propsAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ParlayCandidate {
    ParlayVariant variant;
    List<Leg> legs;
    RiskLevel risk;
    ParlayConfidence confidence;
    String reasoning;

    public int size() {
        return legs.size();
    }
}
