package appraiser.core.port.out;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.ratelimit.EffectiveRateLimit;
import appraiser.core.model.ratelimit.RateLimitDecision;
import appraiser.core.model.ratelimit.RateLimitKey;

/**
 * Port interface for rate limiting operations.
 *
 * <p>Implementations must update each counter atomically.
 */
public interface RateLimiter {

    /**
     * Check whether a request is allowed and count it.
     *
     * @param key the counter to consume from
     * @param limit the limit for the counter's category
     * @return Uni with the decision
     */
    Uni<RateLimitDecision> checkAndConsume(RateLimitKey key, EffectiveRateLimit limit);

    /**
     * Reset one counter.
     *
     * @param key the counter to reset
     * @return Uni completing when reset
     */
    Uni<Void> reset(RateLimitKey key);

    /**
     * Reset every counter.
     *
     * @return Uni completing when cleared
     */
    Uni<Void> clear();
}
