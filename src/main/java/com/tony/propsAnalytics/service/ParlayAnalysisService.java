package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.config.ParlayProperties;
import com.tony.propsAnalytics.model.*;
import com.tony.propsAnalytics.model.dto.ParlayAnalysisRequest;
import com.tony.propsAnalytics.model.dto.ParlayAnalysisResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class ParlayAnalysisService {

    private final PropMatcherService propMatcher;
    private final GradeCalculatorService gradeCalculator;
    private final ParlayBuilderService parlayBuilder;
    private final ParlayPricerService parlayPricer;
    private final ParlayProperties properties;

    /**
     * Analyse complète d'un match : appariement -> notation -> construction -> tarification.
     * Aucune E/S ici, tout est fourni par l'appelant.
     */
    public ParlayAnalysisResponse analyze(ParlayAnalysisRequest request) {
        double stake = request.getStake() != null ? request.getStake() : properties.getDefaultStake();
        ContextSignals context = toContext(request.getContext());

        List<Leg> graded = gradeLegs(request, context);

        List<PricedParlay> parlays = parlayBuilder.buildParlays(graded).stream()
                .map(candidate -> parlayPricer.price(candidate, stake))
                .toList();

        log.info("🎯 Analyse parlay : {} props reçues, {} jambes notées, {} parlays générés",
                sizeOf(request.getProps()), graded.size(), parlays.size());

        return new ParlayAnalysisResponse(stake, graded, parlays);
    }

    /** Vue tabulaire : chaque prop appariée avec sa note, sans construction de parlay. */
    public List<Leg> gradeLegs(ParlayAnalysisRequest request) {
        return gradeLegs(request, toContext(request.getContext()));
    }

    private List<Leg> gradeLegs(ParlayAnalysisRequest request, ContextSignals context) {
        List<PropLine> props = toPropLines(request.getProps());
        List<Prediction> predictions = toPredictions(request.getPredictions());

        return propMatcher.matchProps(props, predictions, context).stream()
                .map(leg -> gradeCalculator.applyGrade(leg, context))
                .sorted(Comparator.comparingDouble(Leg::getGrade).reversed())
                .toList();
    }

    // --- MAPPING DES FLUX ---

    List<PropLine> toPropLines(List<ParlayAnalysisRequest.PropLineRequest> props) {
        if (props == null) return List.of();
        return props.stream()
                .filter(Objects::nonNull)
                .map(p -> PropLine.builder()
                        .playerId(p.getPlayerId())
                        .playerName(p.getPlayerName())
                        .teamId(p.getTeamId())
                        .statType(StatType.fromLabel(p.getStatType()).orElse(null))
                        .line(p.getLine() != null ? p.getLine() : 0.0)
                        .overOdds(p.getOverOdds())
                        .underOdds(p.getUnderOdds())
                        .build())
                .toList();
    }

    List<Prediction> toPredictions(List<ParlayAnalysisRequest.PredictionRequest> predictions) {
        if (predictions == null) return List.of();
        return predictions.stream()
                .filter(Objects::nonNull)
                .filter(p -> p.getPrediction() != null)
                .map(p -> Prediction.builder()
                        .playerId(p.getAthleteId())
                        .statType(StatType.fromLabel(p.getStatType()).orElse(null))
                        .predictedValue(p.getPrediction())
                        .edge(p.getEdge())
                        .confidence(ConfidenceLevel.fromLabel(p.getConfidence()))
                        .trend(Trend.fromLabel(p.getRecentTrend()))
                        .build())
                .filter(p -> p.getStatType() != null)
                .toList();
    }

    ContextSignals toContext(ParlayAnalysisRequest.ContextRequest context) {
        if (context == null) return ContextSignals.empty();

        List<InjuryReport> injuries = context.getInjuries() == null ? List.of() : context.getInjuries().stream()
                .filter(Objects::nonNull)
                .map(i -> new InjuryReport(i.getAthleteId(), i.getStatus(), i.getPosition(), i.getTeamId()))
                .toList();

        return ContextSignals.builder()
                .spread(context.getSpread())
                .overUnder(context.getOverUnder())
                .homeTeamId(context.getHomeTeamId())
                .awayTeamId(context.getAwayTeamId())
                .homeFavorite(context.getHomeFavorite())
                .injuries(injuries)
                .build();
    }

    private int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
