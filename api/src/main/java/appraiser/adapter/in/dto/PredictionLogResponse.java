package appraiser.adapter.in.dto;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import appraiser.core.model.audit.PredictionLog;

public record PredictionLogResponse(
        long id,
        @JsonProperty("api_key_id") Long apiKeyId,
        @JsonProperty("input_features") Map<String, Object> inputFeatures,
        @JsonProperty("predicted_price") double predictedPrice,
        @JsonProperty("response_time_ms") Long responseTimeMs,
        @JsonProperty("request_type") String requestType,
        @JsonProperty("batch_id") String batchId,
        @JsonProperty("created_at") Instant createdAt) {

    public static PredictionLogResponse from(PredictionLog log) {
        return new PredictionLogResponse(
                log.id(),
                log.apiKeyId(),
                log.inputFeatures(),
                log.predictedPrice(),
                log.responseTimeMs(),
                log.requestType().value(),
                log.batchId(),
                log.createdAt());
    }
}
