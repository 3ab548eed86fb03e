package appraiser.adapter.in.dto;

import java.util.List;

import appraiser.core.model.prediction.BatchPrediction;

public record BatchPredictionResponse(List<PredictionResponse> predictions, int count) {

    public static BatchPredictionResponse from(BatchPrediction batch) {
        var predictions = batch.predictions().stream().map(PredictionResponse::from).toList();
        return new BatchPredictionResponse(predictions, predictions.size());
    }
}
