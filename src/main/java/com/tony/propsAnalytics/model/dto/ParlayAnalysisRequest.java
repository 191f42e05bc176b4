package com.tony.propsAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Flux déjà récupérés par la couche appelante pour un match : props, prédictions, contexte.
 */
@Data
public class ParlayAnalysisRequest {

    @Positive
    private Double stake; // mise par défaut si absente

    @NotNull
    @Valid
    private List<PropLineRequest> props = new ArrayList<>();

    @NotNull
    @Valid
    private List<PredictionRequest> predictions = new ArrayList<>();

    @Valid
    private ContextRequest context;

    @Data
    public static class PropLineRequest {
        @NotBlank
        @JsonProperty("player_id")
        private String playerId;
        @JsonProperty("player_name")
        private String playerName;
        @JsonProperty("team_id")
        private String teamId;
        @NotBlank
        @JsonProperty("stat_type")
        private String statType; // ex: "Total Points"
        @NotNull
        private Double line;
        @JsonProperty("over_odds")
        private Integer overOdds;
        @JsonProperty("under_odds")
        private Integer underOdds;
    }

    @Data
    public static class PredictionRequest {
        @NotBlank
        @JsonProperty("athlete_id")
        private String athleteId;
        @NotBlank
        @JsonProperty("stat_type")
        private String statType; // ex: "points"
        @NotNull
        private Double prediction;
        private Double edge;
        private String confidence; // High / Medium / Low
        @JsonProperty("recent_trend")
        private String recentTrend; // hot / cold / neutral
    }

    @Data
    public static class ContextRequest {
        private Double spread;
        @JsonProperty("over_under")
        private Double overUnder;
        @JsonProperty("home_team_id")
        private String homeTeamId;
        @JsonProperty("away_team_id")
        private String awayTeamId;
        @JsonProperty("home_favorite")
        private Boolean homeFavorite;
        private List<InjuryRequest> injuries = new ArrayList<>();
    }

    @Data
    public static class InjuryRequest {
        @JsonProperty("athlete_id")
        private String athleteId;
        private String status;
        private String position;
        @JsonProperty("team_id")
        private String teamId;
    }
}
