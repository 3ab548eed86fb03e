package appraiser.adapter.out.ratelimit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.jboss.logging.Logger;

import appraiser.adapter.out.ratelimit.memory.InMemoryRateLimiter;
import appraiser.core.port.out.RateLimiter;

/**
 * Produces the process-local rate limiter.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    @Produces
    @ApplicationScoped
    public RateLimiter rateLimiter() {
        LOG.info("Using in-memory fixed-window rate limiter");
        return new InMemoryRateLimiter();
    }
}
