package appraiser.adapter.in.health;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import appraiser.core.model.ComponentHealth;
import appraiser.core.port.out.StorageHealthIndicator;

/**
 * Readiness of the credential and audit store.
 *
 * <p>Reports DOWN when any storage indicator is unhealthy or fails to answer.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements AsyncHealthCheck {

    private static final Logger LOG = Logger.getLogger(DatabaseHealthCheck.class);
    static final String NAME = "database";

    private final List<StorageHealthIndicator> indicators;

    @Inject
    public DatabaseHealthCheck(List<StorageHealthIndicator> indicators) {
        this.indicators = indicators;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        return component().map(health -> {
            HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME)
                    .withData("message", health.message())
                    .withData("latency_ms", health.latencyMs());
            return health.healthy() ? builder.up().build() : builder.down().build();
        });
    }

    /**
     * Combined health of all storage indicators.
     */
    public Uni<ComponentHealth> component() {
        if (indicators.isEmpty()) {
            return Uni.createFrom().item(ComponentHealth.healthy(NAME, 0));
        }
        List<Uni<ComponentHealth>> checks = indicators.stream()
                .map(indicator -> indicator.check()
                        .onFailure()
                        .recoverWithItem(e -> {
                            LOG.warnv("Storage health check failed: {0}", e.getMessage());
                            return ComponentHealth.unhealthy(NAME, e.getMessage());
                        }))
                .toList();
        return Uni.join().all(checks).andFailFast().map(DatabaseHealthCheck::combine);
    }

    private static ComponentHealth combine(List<ComponentHealth> results) {
        long latency = 0;
        for (ComponentHealth result : results) {
            if (!result.healthy()) {
                return ComponentHealth.unhealthy(NAME, result.message());
            }
            latency = Math.max(latency, result.latencyMs());
        }
        return ComponentHealth.healthy(NAME, latency);
    }
}
