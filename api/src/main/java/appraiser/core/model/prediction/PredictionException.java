package appraiser.core.model.prediction;

/**
 * Thrown when the model cannot produce an estimate for valid input.
 */
public class PredictionException extends RuntimeException {

    public PredictionException(String message) {
        super(message);
    }

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
