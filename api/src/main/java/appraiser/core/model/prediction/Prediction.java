package appraiser.core.model.prediction;

/**
 * A single model estimate.
 *
 * @param predictedPrice estimated median house value
 * @param currency ISO currency code of the estimate
 */
public record Prediction(double predictedPrice, String currency) {

    public static final String USD = "USD";

    public static Prediction usd(double predictedPrice) {
        return new Prediction(predictedPrice, USD);
    }
}
