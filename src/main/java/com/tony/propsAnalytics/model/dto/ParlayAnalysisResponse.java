package com.tony.propsAnalytics.model.dto;

import com.tony.propsAnalytics.model.Leg;
import com.tony.propsAnalytics.model.PricedParlay;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class ParlayAnalysisResponse {
    private double stake;
    private List<Leg> legs;         // toutes les props appariées, triées par note
    private List<PricedParlay> parlays;
}
