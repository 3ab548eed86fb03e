package appraiser.core.model.audit;

import java.time.Instant;
import java.util.Map;

/**
 * Audit entry for one model estimate.
 *
 * @param id              log identity (0 before the store assigns one)
 * @param apiKeyId        credential that requested the estimate, null once that key is hard-deleted
 * @param inputFeatures   snapshot of the request features, keyed by wire field name
 * @param predictedPrice  the estimate returned
 * @param responseTimeMs  inference duration in milliseconds
 * @param requestType     single or batch
 * @param batchId         shared identifier of a batch, null for single requests
 * @param createdAt       when the estimate was produced
 */
public record PredictionLog(
        long id,
        Long apiKeyId,
        Map<String, Object> inputFeatures,
        double predictedPrice,
        Long responseTimeMs,
        RequestType requestType,
        String batchId,
        Instant createdAt) {

    public PredictionLog {
        if (requestType == null) {
            throw new IllegalArgumentException("requestType cannot be null");
        }
        inputFeatures = inputFeatures == null ? Map.of() : Map.copyOf(inputFeatures);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public PredictionLog withId(long assignedId) {
        return new PredictionLog(
                assignedId, apiKeyId, inputFeatures, predictedPrice, responseTimeMs, requestType, batchId, createdAt);
    }

    public PredictionLog detached() {
        return new PredictionLog(
                id, null, inputFeatures, predictedPrice, responseTimeMs, requestType, batchId, createdAt);
    }
}
