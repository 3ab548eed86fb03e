package appraiser.core.model.ratelimit;

/**
 * Identifies one rate limit counter: a client within an endpoint category.
 *
 * @param clientId network address (or other caller identifier) of the client
 * @param category endpoint category
 */
public record RateLimitKey(String clientId, RateLimitCategory category) {

    private static final String KEY_PREFIX = "appraiser:ratelimit:";

    public RateLimitKey {
        if (clientId == null || clientId.isBlank()) {
            clientId = "unknown";
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
    }

    /**
     * Generate the counter key string.
     *
     * <p>Format: {@code appraiser:ratelimit:{category}:{clientId}}
     *
     * @return the counter key
     */
    public String toCacheKey() {
        return KEY_PREFIX + category.tag() + ":" + clientId;
    }
}
