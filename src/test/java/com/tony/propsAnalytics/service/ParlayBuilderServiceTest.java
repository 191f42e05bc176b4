package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.config.ParlayProperties;
import com.tony.propsAnalytics.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ParlayBuilderServiceTest {

    private ParlayBuilderService parlayBuilder;

    @BeforeEach
    void setUp() {
        parlayBuilder = new ParlayBuilderService(new CorrelationScorer(), new ParlayProperties());
    }

    @Test
    @DisplayName("Le classement exclut les push et trie par |edge| décroissant")
    void rankShouldDropPushAndSortByStrength() {
        Leg small = leg("p1", "BOS", StatType.POINTS, 1.5, ConfidenceLevel.HIGH);
        Leg push = leg("p2", "BOS", StatType.REBOUNDS, 0.0, ConfidenceLevel.HIGH);
        Leg strongUnder = leg("p3", "NYK", StatType.ASSISTS, -6.0, ConfidenceLevel.HIGH);

        List<Leg> pool = parlayBuilder.rankByStrength(List.of(small, push, strongUnder));

        assertThat(pool).containsExactly(strongUnder, small);
    }

    @Test
    @DisplayName("Sans diversification : sélection gloutonne dans l'ordre du classement")
    void greedySelectionShouldFollowRanking() {
        Leg a = leg("p1", "BOS", StatType.POINTS, 6.0, ConfidenceLevel.HIGH);
        Leg b = leg("p2", "BOS", StatType.POINTS, 5.9, ConfidenceLevel.HIGH);
        Leg c = leg("p3", "NYK", StatType.REBOUNDS, 5.8, ConfidenceLevel.HIGH);

        assertThat(parlayBuilder.selectLegs(List.of(a, b, c), 2, false)).containsExactly(a, b);
    }

    @Test
    @DisplayName("Avec diversification : la rotation qui mélange équipes et stats l'emporte")
    void diversifiedSelectionShouldPreferMixedCombination() {
        Leg a = leg("p1", "BOS", StatType.POINTS, 6.0, ConfidenceLevel.HIGH);
        Leg b = leg("p2", "BOS", StatType.POINTS, 5.9, ConfidenceLevel.HIGH);
        Leg c = leg("p3", "NYK", StatType.REBOUNDS, 5.8, ConfidenceLevel.HIGH);

        List<Leg> selected = parlayBuilder.selectLegs(List.of(a, b, c), 2, true);

        // Rotation 2 (C puis A) : edge moyen le plus haut parmi les paires diversifiées
        assertThat(selected).containsExactly(c, a);
    }

    @Test
    @DisplayName("Jamais deux fois le même joueur sur la même stat")
    void selectionShouldSkipDuplicatePlayerStat() {
        Leg main = leg("p1", "BOS", StatType.POINTS, 6.0, ConfidenceLevel.HIGH);
        Leg sameKey = leg("p1", "BOS", StatType.POINTS, 5.5, ConfidenceLevel.HIGH);
        Leg other = leg("p2", "NYK", StatType.REBOUNDS, 5.0, ConfidenceLevel.HIGH);

        assertThat(parlayBuilder.selectLegs(List.of(main, sameKey, other), 2, false)).containsExactly(main, other);
        assertThat(parlayBuilder.selectLegs(List.of(main, sameKey), 2, true)).isEmpty();
    }

    @Test
    @DisplayName("Cinq jambes : les quatre variantes sont générées, sans doublon")
    void shouldBuildAllVariants() {
        List<Leg> legs = List.of(
                leg("p1", "BOS", StatType.POINTS, 6.0, ConfidenceLevel.HIGH),
                leg("p2", "NYK", StatType.REBOUNDS, 5.0, ConfidenceLevel.MEDIUM),
                leg("p3", "BOS", StatType.ASSISTS, 4.0, ConfidenceLevel.HIGH),
                leg("p4", "NYK", StatType.POINTS, -3.5, ConfidenceLevel.LOW),
                leg("p5", "BOS", StatType.THREE_POINTERS, 2.5, ConfidenceLevel.HIGH));

        List<ParlayCandidate> parlays = parlayBuilder.buildParlays(legs);

        assertThat(parlays).extracting(ParlayCandidate::getVariant).containsExactly(
                ParlayVariant.SAFE_TWO_LEG,
                ParlayVariant.BALANCED_THREE_LEG,
                ParlayVariant.AGGRESSIVE_FOUR_LEG,
                ParlayVariant.VALUE_PLAY);
        assertThat(parlays).extracting(ParlayCandidate::size).containsExactly(2, 3, 4, 3);

        ParlayCandidate safe = parlays.get(0);
        assertThat(safe.getRisk()).isEqualTo(RiskLevel.LOW);
        assertThat(safe.getConfidence()).isEqualTo(ParlayConfidence.HIGH);
        assertThat(parlays.get(1).getConfidence()).isEqualTo(ParlayConfidence.MEDIUM_HIGH);
        assertThat(parlays.get(2).getRisk()).isEqualTo(RiskLevel.HIGH);

        for (ParlayCandidate parlay : parlays) {
            Set<String> keys = parlay.getLegs().stream().map(Leg::getKey).collect(Collectors.toSet());
            assertThat(keys).hasSize(parlay.size());
            assertThat(parlay.getReasoning()).isNotBlank();
        }
    }

    @Test
    @DisplayName("Value play : uniquement les edges > 2, émis dès deux jambes")
    void valuePlayShouldUseStrongPositiveEdgesOnly() {
        Leg strongOver = leg("p1", "BOS", StatType.POINTS, 3.0, ConfidenceLevel.HIGH);
        Leg over = leg("p2", "NYK", StatType.REBOUNDS, 2.5, ConfidenceLevel.HIGH);
        Leg strongUnder = leg("p3", "BOS", StatType.ASSISTS, -4.0, ConfidenceLevel.HIGH);
        Leg weak = leg("p4", "NYK", StatType.STEALS, 1.0, ConfidenceLevel.HIGH);

        List<ParlayCandidate> parlays = parlayBuilder.buildParlays(List.of(strongOver, over, strongUnder, weak));

        ParlayCandidate valuePlay = parlays.stream()
                .filter(p -> p.getVariant() == ParlayVariant.VALUE_PLAY)
                .findFirst().orElseThrow();
        assertThat(valuePlay.getLegs()).containsExactly(strongOver, over);
        assertThat(valuePlay.getRisk()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    @DisplayName("Une seule jambe value : pas de value play")
    void valuePlayShouldNeedTwoLegs() {
        List<ParlayCandidate> parlays = parlayBuilder.buildParlays(List.of(
                leg("p1", "BOS", StatType.POINTS, 3.0, ConfidenceLevel.HIGH),
                leg("p2", "NYK", StatType.REBOUNDS, -2.5, ConfidenceLevel.HIGH)));

        assertThat(parlays).extracting(ParlayCandidate::getVariant).containsExactly(ParlayVariant.SAFE_TWO_LEG);
    }

    @Test
    @DisplayName("Un push n'entre dans aucune variante")
    void pushShouldNeverBeSelected() {
        Leg push = leg("p9", "BOS", StatType.BLOCKS, 0.0, ConfidenceLevel.HIGH);
        List<ParlayCandidate> parlays = parlayBuilder.buildParlays(List.of(
                push,
                leg("p1", "BOS", StatType.POINTS, 3.0, ConfidenceLevel.HIGH),
                leg("p2", "NYK", StatType.REBOUNDS, 2.5, ConfidenceLevel.HIGH),
                leg("p3", "NYK", StatType.ASSISTS, 4.5, ConfidenceLevel.MEDIUM)));

        assertThat(parlays).isNotEmpty();
        assertThat(parlays).noneMatch(p -> p.getLegs().contains(push));
        assertThat(parlays).extracting(ParlayCandidate::getVariant).doesNotContain(ParlayVariant.AGGRESSIVE_FOUR_LEG);
    }

    @Test
    @DisplayName("Pas assez de jambes : aucune variante, sans erreur")
    void tooFewLegsShouldYieldNothing() {
        assertThat(parlayBuilder.buildParlays(List.of(leg("p1", "BOS", StatType.POINTS, 3.0, ConfidenceLevel.HIGH)))).isEmpty();
        assertThat(parlayBuilder.buildParlays(List.of())).isEmpty();
        assertThat(parlayBuilder.buildParlays(null)).isEmpty();
    }

    @Test
    @DisplayName("Même entrée, même sortie : sélection déterministe")
    void selectionShouldBeDeterministic() {
        List<Leg> legs = List.of(
                leg("p1", "BOS", StatType.POINTS, 6.0, ConfidenceLevel.HIGH),
                leg("p2", "BOS", StatType.POINTS, 5.9, ConfidenceLevel.HIGH),
                leg("p3", "NYK", StatType.REBOUNDS, 5.8, ConfidenceLevel.HIGH),
                leg("p4", "NYK", StatType.ASSISTS, 5.7, ConfidenceLevel.LOW),
                leg("p5", "BOS", StatType.BLOCKS, 2.1, ConfidenceLevel.MEDIUM),
                leg("p6", "NYK", StatType.POINTS, -5.0, ConfidenceLevel.HIGH));

        assertThat(parlayBuilder.buildParlays(legs)).isEqualTo(parlayBuilder.buildParlays(legs));
    }

    @Test
    @DisplayName("Le raisonnement résume edge moyen, diversité et confiance")
    void reasoningShouldDescribeCombination() {
        String diverse = parlayBuilder.generateReasoning(List.of(
                leg("p1", "BOS", StatType.POINTS, 5.0, ConfidenceLevel.HIGH),
                leg("p2", "NYK", StatType.REBOUNDS, -3.0, ConfidenceLevel.HIGH)));
        String correlated = parlayBuilder.generateReasoning(List.of(
                leg("p1", "BOS", StatType.POINTS, 5.0, ConfidenceLevel.HIGH),
                leg("p2", "BOS", StatType.POINTS, 3.0, ConfidenceLevel.LOW)));

        assertThat(diverse)
                .contains("edge moyen de 4.0 points")
                .contains("2 équipes")
                .contains("Types de stats variés")
                .contains("Toutes les jambes ont une confiance élevée.");
        assertThat(correlated)
                .contains("même équipe")
                .contains("Même type de stat partout")
                .contains("1 jambe(s) sur 2");
    }

    private Leg leg(String playerId, String teamId, StatType stat, double edge, ConfidenceLevel confidence) {
        RecommendedSide side = RecommendedSide.fromEdge(edge);
        return Leg.builder()
                .playerId(playerId).playerName("Player " + playerId).teamId(teamId)
                .statType(stat).line(10.5)
                .overOdds(-110).underOdds(-110)
                .predictedValue(10.5 + edge).edge(edge)
                .confidence(confidence)
                .recommendedSide(side).recommendedOdds(-110)
                .overHitProbability(0.6).underHitProbability(0.4)
                .build();
    }
}
