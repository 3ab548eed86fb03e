package appraiser.core.service.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appraiser.core.config.RateLimitConfig;
import appraiser.core.model.ratelimit.EffectiveRateLimit;
import appraiser.core.model.ratelimit.RateLimitCategory;
import appraiser.core.model.ratelimit.RateLimitDecision;
import appraiser.core.model.ratelimit.RateLimitKey;
import appraiser.core.port.out.RateLimiter;
import appraiser.core.port.out.ServiceMetrics;

/**
 * Admission control per client and endpoint category.
 *
 * <p>Counters are best-effort throttling, not a security boundary: they slow down
 * abuse of the anonymous endpoints but do not stop distributed credential stuffing.
 */
@ApplicationScoped
public class RateLimitService {

    private static final Logger LOG = Logger.getLogger(RateLimitService.class);

    private final RateLimiter rateLimiter;
    private final RateLimitConfig config;
    private final ServiceMetrics metrics;

    @Inject
    public RateLimitService(RateLimiter rateLimiter, RateLimitConfig config, ServiceMetrics metrics) {
        this.rateLimiter = rateLimiter;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Count a request and decide whether it is admitted.
     *
     * @param clientId client network address
     * @param category endpoint category
     * @return Uni with the decision
     */
    public Uni<RateLimitDecision> checkAndConsume(String clientId, RateLimitCategory category) {
        if (!config.enabled()) {
            return Uni.createFrom().item(RateLimitDecision.allow());
        }

        RateLimitKey key = new RateLimitKey(clientId, category);
        return rateLimiter.checkAndConsume(key, resolve(category)).invoke(decision -> {
            if (!decision.allowed()) {
                metrics.recordRateLimited(category);
                LOG.warnv(
                        "Rate limit exceeded for {0} on {1} (limit {2}/{3}s)",
                        key.clientId(), category.tag(), decision.limit(), decision.windowSeconds());
            }
        });
    }

    /**
     * Resolve the configured limit for a category.
     *
     * @param category endpoint category
     * @return the effective limit
     */
    public EffectiveRateLimit resolve(RateLimitCategory category) {
        return switch (category) {
            case KEY_ISSUANCE -> EffectiveRateLimit.of(config.keyIssuanceRequests(), config.keyIssuanceWindowSeconds());
            case TOKEN_EXCHANGE -> EffectiveRateLimit.of(
                    config.tokenExchangeRequests(), config.tokenExchangeWindowSeconds());
            case GENERAL -> EffectiveRateLimit.of(config.generalRequests(), config.generalWindowSeconds());
        };
    }

    /**
     * Reset one client's counter for a category.
     */
    public Uni<Void> reset(String clientId, RateLimitCategory category) {
        return rateLimiter.reset(new RateLimitKey(clientId, category));
    }

    /**
     * Reset every counter.
     */
    public Uni<Void> resetAll() {
        return rateLimiter.clear();
    }

    public boolean isEnabled() {
        return config.enabled();
    }

    public boolean includeHeaders() {
        return config.includeHeaders();
    }
}
