package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
@Slf4j
public class PropMatcherService {

    private static final double BASE_HIT_PROBABILITY = 0.55;
    private static final double HIT_PROBABILITY_PER_POINT = 0.02;
    private static final double MAX_EDGE_FOR_PROBABILITY = 10.0;

    /**
     * Apparie chaque prop principale (cotée des deux côtés) à la prédiction du même joueur
     * sur la même stat. Les props sans prédiction sont ignorées : le modèle n'a pas d'avis
     * sur toutes les lignes proposées.
     */
    public List<Leg> matchProps(List<PropLine> props, List<Prediction> predictions, ContextSignals context) {
        if (props == null || props.isEmpty()) return List.of();
        List<Prediction> available = predictions == null ? List.of() : predictions;
        ContextSignals ctx = context == null ? ContextSignals.empty() : context;

        List<Leg> legs = new ArrayList<>();
        int alternates = 0;
        int unmatched = 0;

        for (PropLine prop : props) {
            if (prop == null) continue;
            if (!prop.isTradable()) {
                alternates++;
                continue;
            }

            Optional<Prediction> prediction = findPrediction(prop, available);
            if (prediction.isEmpty()) {
                unmatched++;
                log.debug("Pas de prédiction pour {} ({})", prop.getPlayerName(), prop.getStatType());
                continue;
            }
            legs.add(buildLeg(prop, prediction.get(), ctx));
        }

        log.debug("Appariement : {} jambes, {} lignes alternatives, {} props sans prédiction",
                legs.size(), alternates, unmatched);
        return legs;
    }

    /**
     * Même joueur, même stat en priorité. Sinon la prédiction la plus précise dont les composantes
     * sont contenues dans celles de la prop (ex : prop PRA, prédiction PR ou points).
     */
    Optional<Prediction> findPrediction(PropLine prop, List<Prediction> predictions) {
        StatType propStat = prop.getStatType();
        if (propStat == null) return Optional.empty();

        List<Prediction> compatible = predictions.stream()
                .filter(Objects::nonNull)
                .filter(p -> Objects.equals(p.getPlayerId(), prop.getPlayerId()))
                .filter(p -> p.getStatType() != null)
                .filter(p -> propStat.baseComponents().containsAll(p.getStatType().baseComponents()))
                .toList();

        Optional<Prediction> exact = compatible.stream()
                .filter(p -> p.getStatType() == propStat)
                .findFirst();
        if (exact.isPresent()) return exact;

        Optional<Prediction> partial = compatible.stream()
                .max(Comparator.comparingInt(p -> p.getStatType().baseComponents().size()));
        partial.ifPresent(p -> log.debug("Appariement partiel {} -> {} pour {}",
                propStat, p.getStatType(), prop.getPlayerName()));
        return partial;
    }

    Leg buildLeg(PropLine prop, Prediction prediction, ContextSignals context) {
        double edge = prediction.edgeAgainst(prop.getLine());
        RecommendedSide side = RecommendedSide.fromEdge(edge);

        double overProb;
        double underProb;
        if (side == RecommendedSide.PUSH) {
            overProb = 0.5;
            underProb = 0.5;
        } else {
            double favored = clamp(BASE_HIT_PROBABILITY
                    + Math.min(Math.abs(edge), MAX_EDGE_FOR_PROBABILITY) * HIT_PROBABILITY_PER_POINT);
            overProb = side == RecommendedSide.OVER ? favored : 1.0 - favored;
            underProb = side == RecommendedSide.UNDER ? favored : 1.0 - favored;
        }

        return Leg.builder()
                .playerId(prop.getPlayerId())
                .playerName(prop.getPlayerName())
                .teamId(prop.getTeamId())
                .venue(context.sideOf(prop.getTeamId()))
                .statType(prop.getStatType())
                .line(prop.getLine())
                .overOdds(prop.getOverOdds())
                .underOdds(prop.getUnderOdds())
                .predictedValue(prediction.getPredictedValue())
                .edge(edge)
                .confidence(prediction.getConfidence())
                .trend(prediction.getTrend())
                .recommendedSide(side)
                // Push : on garde la cote over pour l'affichage
                .recommendedOdds(side == RecommendedSide.UNDER ? prop.getUnderOdds() : prop.getOverOdds())
                .overHitProbability(overProb)
                .underHitProbability(underProb)
                .gradeTier(GradeTier.WEAK)
                .build();
    }

    private double clamp(double p) {
        return Math.max(0.0, Math.min(1.0, p));
    }
}
