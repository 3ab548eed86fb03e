package appraiser.core.model.audit;

/**
 * Prediction counts across all callers and for the requesting caller.
 */
public record PredictionStats(long totalPredictions, long predictionsByUser) {}
