package appraiser.core.model.ratelimit;

/**
 * The resolved rate limit for a category.
 *
 * @param requestsPerWindow the maximum requests allowed per window
 * @param windowSeconds the duration of the window in seconds
 */
public record EffectiveRateLimit(long requestsPerWindow, long windowSeconds) {

    public EffectiveRateLimit {
        if (requestsPerWindow < 0) {
            throw new IllegalArgumentException("requestsPerWindow must be non-negative");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive");
        }
    }

    public static EffectiveRateLimit of(long requestsPerWindow, long windowSeconds) {
        return new EffectiveRateLimit(requestsPerWindow, windowSeconds);
    }

    public long windowMillis() {
        return windowSeconds * 1000;
    }
}
