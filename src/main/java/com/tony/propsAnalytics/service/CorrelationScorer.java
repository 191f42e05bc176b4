package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.model.Leg;
import com.tony.propsAnalytics.model.StatType;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Score de diversification d'un ensemble de jambes.
 * Plus le score est haut, moins les issues sont corrélées (env. -30 à +50).
 */
@Service
public class CorrelationScorer {

    public static final int MULTI_TEAM_BONUS = 20;
    public static final int PER_STAT_TYPE_BONUS = 10;
    public static final int SINGLE_STAT_PENALTY = 30;

    public int score(Collection<Leg> legs) {
        if (legs == null || legs.isEmpty()) return 0;

        int score = 0;

        Set<String> teams = distinctTeams(legs);
        if (teams.size() > 1) score += MULTI_TEAM_BONUS;

        Set<StatType> statTypes = distinctStatTypes(legs);
        score += statTypes.size() * PER_STAT_TYPE_BONUS;

        // Même stat partout : issues fortement corrélées
        if (statTypes.size() == 1) score -= SINGLE_STAT_PENALTY;

        return score;
    }

    public Set<StatType> distinctStatTypes(Collection<Leg> legs) {
        return legs.stream()
                .map(Leg::getStatType)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    public Set<String> distinctTeams(Collection<Leg> legs) {
        return legs.stream()
                .map(Leg::getTeamId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }
}
