package appraiser.adapter.out.model;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import appraiser.core.port.out.RegressionModel;

/**
 * Ordinary least squares model: {@code intercept + coefficients · features}.
 *
 * <p>Serialized as JSON:
 * <pre>
 * {
 *   "name": "california-housing-linear",
 *   "version": "1.0.0",
 *   "features": ["longitude", ...],
 *   "intercept": -2250000.0,
 *   "coefficients": [-26800.0, ...]
 * }
 * </pre>
 */
public final class LinearRegressionModel implements RegressionModel {

    private final String name;
    private final String version;
    private final List<String> featureNames;
    private final double intercept;
    private final double[] coefficients;

    public LinearRegressionModel(
            String name, String version, List<String> featureNames, double intercept, double[] coefficients) {
        if (coefficients == null || coefficients.length == 0) {
            throw new ModelLoadException("Model has no coefficients");
        }
        if (featureNames != null && !featureNames.isEmpty() && featureNames.size() != coefficients.length) {
            throw new ModelLoadException("Model declares " + featureNames.size() + " features but "
                    + coefficients.length + " coefficients");
        }
        this.name = name == null ? "unnamed" : name;
        this.version = version == null ? "unknown" : version;
        this.featureNames = featureNames == null ? List.of() : List.copyOf(featureNames);
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
    }

    /**
     * Read a model from its JSON form.
     *
     * @param in JSON stream (not closed)
     * @param objectMapper mapper used to parse the stream
     * @return the model
     * @throws ModelLoadException if the document is unreadable or inconsistent
     */
    public static LinearRegressionModel read(InputStream in, ObjectMapper objectMapper) {
        try {
            ModelDocument doc = objectMapper.readValue(in, ModelDocument.class);
            return new LinearRegressionModel(doc.name(), doc.version(), doc.features(), doc.intercept(),
                    doc.coefficients());
        } catch (IOException e) {
            throw new ModelLoadException("Model file is not valid JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public int featureCount() {
        return coefficients.length;
    }

    @Override
    public double predict(double[] features) {
        if (features.length != coefficients.length) {
            throw new IllegalArgumentException(
                    "Expected " + coefficients.length + " features but got " + features.length);
        }
        double sum = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            sum += coefficients[i] * features[i];
        }
        return sum;
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public List<String> featureNames() {
        return featureNames;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ModelDocument(
            String name, String version, List<String> features, double intercept, double[] coefficients) {}

    /**
     * Thrown when the model cannot be loaded.
     */
    public static class ModelLoadException extends RuntimeException {
        public ModelLoadException(String message) {
            super(message);
        }

        public ModelLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
