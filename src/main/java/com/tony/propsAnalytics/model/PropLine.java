package com.tony.propsAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Ligne de prop telle que publiée par le bookmaker (cotes américaines).
 */
@Value
@Builder
public class PropLine {
    String playerId;
    String playerName;
    String teamId;
    StatType statType;
    double line;
    Integer overOdds;
    Integer underOdds;

    /** Une ligne "principale" est cotée des deux côtés ; sinon c'est une ligne alternative. */
    public boolean isTradable() {
        return overOdds != null && underOdds != null;
    }
}
