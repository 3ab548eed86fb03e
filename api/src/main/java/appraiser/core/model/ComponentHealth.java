package appraiser.core.model;

/**
 * Health status of a backing component (datastore, model).
 */
public record ComponentHealth(boolean healthy, String name, String message, long latencyMs) {

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(true, name, "OK", latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message) {
        return new ComponentHealth(false, name, message, -1);
    }
}
