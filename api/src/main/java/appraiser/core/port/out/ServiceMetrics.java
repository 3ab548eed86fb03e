package appraiser.core.port.out;

import appraiser.core.model.audit.RequestType;
import appraiser.core.model.ratelimit.RateLimitCategory;

/**
 * Port for recording operational metrics.
 */
public interface ServiceMetrics {

    void recordKeyIssued();

    /**
     * Record an API key to session token exchange.
     *
     * @param success whether a token was minted
     */
    void recordTokenExchange(boolean success);

    /**
     * Record a request rejected by the session gate.
     *
     * @param reason internal reason (never sent to clients)
     */
    void recordGateRejection(String reason);

    void recordRateLimited(RateLimitCategory category);

    /**
     * Record model inference.
     *
     * @param type single or batch
     * @param rows number of rows estimated
     * @param durationMs inference duration
     */
    void recordPrediction(RequestType type, int rows, long durationMs);
}
