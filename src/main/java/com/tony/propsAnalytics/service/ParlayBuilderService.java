package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.config.ParlayProperties;
import com.tony.propsAnalytics.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
@RequiredArgsConstructor
@Slf4j
public class ParlayBuilderService {

    private final CorrelationScorer correlationScorer;
    private final ParlayProperties properties;

    /**
     * Construit les variantes de parlay (2, 3, 4 jambes + value play) à partir de toutes les
     * jambes notées. Une variante sans assez de jambes uniques n'est pas émise.
     */
    public List<ParlayCandidate> buildParlays(List<Leg> legs) {
        List<Leg> pool = rankByStrength(legs);
        List<ParlayCandidate> parlays = new ArrayList<>();

        for (ParlayVariant variant : ParlayVariant.values()) {
            List<Leg> source = variant == ParlayVariant.VALUE_PLAY ? valueLegs(pool) : pool;
            List<Leg> selected = selectLegs(source, variant.getSize(), variant.isDiversified());

            if (selected.size() < variant.minimumLegs()) {
                log.debug("Variante {} ignorée : {} jambe(s) disponible(s)", variant.getId(), selected.size());
                continue;
            }

            parlays.add(ParlayCandidate.builder()
                    .variant(variant)
                    .legs(List.copyOf(selected))
                    .risk(variant.getRisk())
                    .confidence(variant.getConfidence())
                    .reasoning(generateReasoning(selected))
                    .build());
        }
        return parlays;
    }

    /** Jambes exploitables (hors push), triées par |edge| décroissant. Tri stable. */
    public List<Leg> rankByStrength(List<Leg> legs) {
        if (legs == null) return List.of();
        List<Leg> pool = new ArrayList<>(legs.stream()
                .filter(Objects::nonNull)
                .filter(l -> !l.isPush())
                .toList());
        pool.sort(Comparator.comparingDouble(Leg::getStrength).reversed());
        return pool;
    }

    /**
     * Sélection de {@code count} jambes sans doublon joueur+stat.
     * Sans diversification : glouton pur sur le classement.
     * Avec diversification : plusieurs départs (rotations fixes), on garde le sous-ensemble
     * qui maximise 0.7 x edge moyen + 0.3 x score de corrélation.
     */
    public List<Leg> selectLegs(List<Leg> pool, int count, boolean diversify) {
        if (pool == null || pool.isEmpty() || count <= 0) return List.of();

        if (!diversify) {
            return walkFrom(pool, 0, count);
        }

        int attempts = Math.min(properties.getRotationAttempts(), pool.size());
        List<Leg> best = List.of();
        double bestScore = Double.NEGATIVE_INFINITY;

        for (int offset = 0; offset < attempts; offset++) {
            List<Leg> candidate = walkFrom(pool, offset, count);
            if (candidate.size() < count) continue;

            double score = scoreCombination(candidate);
            log.debug("Rotation {} : score {}", offset, score);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        return best;
    }

    double scoreCombination(List<Leg> legs) {
        double meanEdge = StatUtils.mean(legs.stream().mapToDouble(Leg::getStrength).toArray());
        int correlation = correlationScorer.score(legs);
        return meanEdge * properties.getEdgeWeight() + correlation * properties.getCorrelationWeight();
    }

    // Parcours circulaire du classement à partir de l'offset
    private List<Leg> walkFrom(List<Leg> pool, int offset, int count) {
        List<Leg> selected = new ArrayList<>();
        Set<String> usedKeys = new HashSet<>();
        int n = pool.size();

        for (int k = 0; k < n && selected.size() < count; k++) {
            Leg leg = pool.get((offset + k) % n);
            if (usedKeys.add(leg.getKey())) {
                selected.add(leg);
            }
        }
        return selected;
    }

    private List<Leg> valueLegs(List<Leg> pool) {
        return pool.stream()
                .filter(l -> l.getEdge() > properties.getValuePlayMinEdge())
                .toList();
    }

    String generateReasoning(List<Leg> legs) {
        double avgEdge = StatUtils.mean(legs.stream().mapToDouble(Leg::getStrength).toArray());
        int teams = correlationScorer.distinctTeams(legs).size();
        int statTypes = correlationScorer.distinctStatTypes(legs).size();
        long highConfidence = legs.stream().filter(l -> l.getConfidence() == ConfidenceLevel.HIGH).count();

        StringBuilder reasoning = new StringBuilder(String.format(Locale.ROOT,
                "Ce parlay présente un edge moyen de %.1f points face aux lignes Vegas. ", avgEdge));

        if (teams > 1) {
            reasoning.append("Props réparties sur ").append(teams).append(" équipes, risque de corrélation réduit. ");
        } else {
            reasoning.append("Toutes les props viennent de la même équipe : corrélation plus forte. ");
        }

        if (statTypes >= legs.size() - 1 && statTypes > 1) {
            reasoning.append("Types de stats variés : bonne indépendance des issues. ");
        } else if (statTypes == 1) {
            reasoning.append("Même type de stat partout : issues corrélées. ");
        }

        if (highConfidence == legs.size()) {
            reasoning.append("Toutes les jambes ont une confiance élevée.");
        } else if (highConfidence > 0) {
            reasoning.append(highConfidence).append(" jambe(s) sur ").append(legs.size())
                    .append(" avec une confiance élevée.");
        }
        return reasoning.toString().trim();
    }
}
