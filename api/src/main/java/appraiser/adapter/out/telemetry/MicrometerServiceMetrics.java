package appraiser.adapter.out.telemetry;

import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import appraiser.core.model.audit.RequestType;
import appraiser.core.model.ratelimit.RateLimitCategory;
import appraiser.core.port.out.ServiceMetrics;

/**
 * Micrometer-backed operational metrics.
 *
 * <p>Records:
 * <ul>
 *   <li>{@code appraiser.auth.keys.issued} - API keys issued</li>
 *   <li>{@code appraiser.auth.token.exchanges} - key to token exchanges by outcome</li>
 *   <li>{@code appraiser.auth.gate.rejections} - bearer tokens rejected by reason</li>
 *   <li>{@code appraiser.ratelimit.rejections} - requests rejected by category</li>
 *   <li>{@code appraiser.prediction.duration} - inference latency by request type</li>
 *   <li>{@code appraiser.prediction.rows} - rows estimated per request</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerServiceMetrics implements ServiceMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerServiceMetrics(
            MeterRegistry registry,
            @ConfigProperty(name = "appraiser.metrics.enabled", defaultValue = "true") boolean enabled) {
        this.registry = registry;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordKeyIssued() {
        if (!enabled) {
            return;
        }

        Counter.builder("appraiser.auth.keys.issued")
                .description("API keys issued")
                .register(registry)
                .increment();
    }

    @Override
    public void recordTokenExchange(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("appraiser.auth.token.exchanges")
                .description("API key to session token exchanges")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordGateRejection(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("appraiser.auth.gate.rejections")
                .description("Bearer tokens rejected by the session gate")
                .tag("reason", nullSafe(reason))
                .register(registry)
                .increment();
    }

    @Override
    public void recordRateLimited(RateLimitCategory category) {
        if (!enabled) {
            return;
        }

        Counter.builder("appraiser.ratelimit.rejections")
                .description("Requests rejected by rate limiting")
                .tag("category", category.tag())
                .register(registry)
                .increment();
    }

    @Override
    public void recordPrediction(RequestType type, int rows, long durationMs) {
        if (!enabled) {
            return;
        }

        Timer.builder("appraiser.prediction.duration")
                .description("Model inference latency")
                .tag("type", type.value())
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);

        DistributionSummary.builder("appraiser.prediction.rows")
                .description("Rows estimated per request")
                .tag("type", type.value())
                .register(registry)
                .record(rows);
    }

    private String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
