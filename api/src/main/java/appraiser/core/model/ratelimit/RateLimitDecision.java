package appraiser.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed whether the request is admitted
 * @param remaining requests remaining in the current window
 * @param limit the total limit for the window
 * @param windowSeconds the window duration in seconds
 * @param resetAt when the current window ends
 * @param retryAfterSeconds seconds until the client can retry (only meaningful when not allowed)
 */
public record RateLimitDecision(
        boolean allowed, long remaining, long limit, long windowSeconds, Instant resetAt, long retryAfterSeconds) {

    /**
     * Create an "allowed" decision used when rate limiting is disabled.
     *
     * @return an allowed decision
     */
    public static RateLimitDecision allow() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, 0, Instant.MAX, 0);
    }

    public static RateLimitDecision allow(long remaining, long limit, long windowSeconds, Instant resetAt) {
        return new RateLimitDecision(true, remaining, limit, windowSeconds, resetAt, 0);
    }

    public static RateLimitDecision rejected(long limit, long windowSeconds, Instant resetAt, long retryAfterSeconds) {
        return new RateLimitDecision(false, 0, limit, windowSeconds, resetAt, retryAfterSeconds);
    }

    /**
     * Reset time as epoch seconds, for the {@code X-RateLimit-Reset} header.
     */
    public long resetAtEpochSeconds() {
        return resetAt == null || Instant.MAX.equals(resetAt) ? 0 : resetAt.getEpochSecond();
    }
}
