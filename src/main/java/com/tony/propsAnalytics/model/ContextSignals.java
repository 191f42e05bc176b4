package com.tony.propsAnalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Contexte du match (lieu, blessures, lignes du marché). Toutes les valeurs sont optionnelles.
 */
@Value
@Builder
public class ContextSignals {
    Double spread;      // ligne de l'équipe à domicile : négatif = domicile favori
    Double overUnder;
    String homeTeamId;
    String awayTeamId;
    Boolean homeFavorite;
    @Builder.Default
    List<InjuryReport> injuries = List.of();

    public static ContextSignals empty() {
        return ContextSignals.builder().build();
    }

    public TeamSide sideOf(String teamId) {
        if (teamId == null) return TeamSide.UNKNOWN;
        if (teamId.equals(homeTeamId)) return TeamSide.HOME;
        if (teamId.equals(awayTeamId)) return TeamSide.AWAY;
        return TeamSide.UNKNOWN;
    }

    public TeamSide favoriteSide() {
        if (homeFavorite != null) return homeFavorite ? TeamSide.HOME : TeamSide.AWAY;
        if (spread == null || spread == 0.0) return TeamSide.UNKNOWN;
        return spread < 0 ? TeamSide.HOME : TeamSide.AWAY;
    }

    public boolean isUnderdog(TeamSide side) {
        TeamSide favorite = favoriteSide();
        return side != TeamSide.UNKNOWN && favorite != TeamSide.UNKNOWN && side != favorite;
    }

    public List<InjuryReport> injuriesOf(String teamId) {
        if (teamId == null || injuries == null) return List.of();
        return injuries.stream()
                .filter(Objects::nonNull)
                .filter(i -> teamId.equals(i.teamId()))
                .toList();
    }
}
