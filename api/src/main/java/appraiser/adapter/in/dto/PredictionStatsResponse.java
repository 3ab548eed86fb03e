package appraiser.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import appraiser.core.model.audit.PredictionStats;

public record PredictionStatsResponse(
        @JsonProperty("total_predictions") long totalPredictions,
        @JsonProperty("predictions_by_user") long predictionsByUser) {

    public static PredictionStatsResponse from(PredictionStats stats) {
        return new PredictionStatsResponse(stats.totalPredictions(), stats.predictionsByUser());
    }
}
