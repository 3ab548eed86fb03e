package appraiser.core.model.prediction;

import java.util.Arrays;
import java.util.Optional;

/**
 * Categorical proximity of a block to the ocean.
 *
 * <p>Declaration order is the one-hot column order the model was trained with.
 */
public enum OceanProximity {
    LESS_THAN_ONE_HOUR("<1H OCEAN"),
    INLAND("INLAND"),
    ISLAND("ISLAND"),
    NEAR_BAY("NEAR BAY"),
    NEAR_OCEAN("NEAR OCEAN");

    private final String label;

    OceanProximity(String label) {
        this.label = label;
    }

    /**
     * The label clients send and the training data used.
     */
    public String label() {
        return label;
    }

    public static Optional<OceanProximity> fromLabel(String label) {
        return Arrays.stream(values()).filter(p -> p.label.equals(label)).findFirst();
    }
}
