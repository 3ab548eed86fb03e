package appraiser.core.model.audit;

/**
 * How a prediction was requested.
 */
public enum RequestType {
    SINGLE("single"),
    BATCH("batch");

    private final String value;

    RequestType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RequestType fromValue(String value) {
        for (RequestType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown request type: " + value);
    }
}
