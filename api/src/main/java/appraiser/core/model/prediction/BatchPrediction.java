package appraiser.core.model.prediction;

import java.util.List;

/**
 * Estimates for a batch of houses, in request order.
 *
 * @param predictions one estimate per input
 * @param batchId identifier shared by the batch's audit entries
 */
public record BatchPrediction(List<Prediction> predictions, String batchId) {

    public BatchPrediction {
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
    }

    public int count() {
        return predictions.size();
    }
}
