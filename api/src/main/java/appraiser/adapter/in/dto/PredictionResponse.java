package appraiser.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import appraiser.core.model.prediction.Prediction;

public record PredictionResponse(@JsonProperty("predicted_price") double predictedPrice, String currency) {

    public static PredictionResponse from(Prediction prediction) {
        return new PredictionResponse(prediction.predictedPrice(), prediction.currency());
    }
}
