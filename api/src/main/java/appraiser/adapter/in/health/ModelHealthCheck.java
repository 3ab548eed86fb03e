package appraiser.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import appraiser.core.model.ComponentHealth;
import appraiser.core.port.out.RegressionModel;

/**
 * Readiness of the regression model: it must answer a zero-vector estimate with a
 * finite number.
 */
@Readiness
@ApplicationScoped
public class ModelHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(ModelHealthCheck.class);
    static final String NAME = "model";

    private final RegressionModel model;

    @Inject
    public ModelHealthCheck(RegressionModel model) {
        this.model = model;
    }

    @Override
    public HealthCheckResponse call() {
        ComponentHealth health = component();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named(NAME)
                .withData("message", health.message())
                .withData("features", model.featureCount());
        return health.healthy() ? builder.up().build() : builder.down().build();
    }

    public ComponentHealth component() {
        long start = System.nanoTime();
        try {
            double sample = model.predict(new double[model.featureCount()]);
            if (!Double.isFinite(sample)) {
                return ComponentHealth.unhealthy(NAME, "Model produced a non-finite estimate");
            }
            return ComponentHealth.healthy(NAME, (System.nanoTime() - start) / 1_000_000);
        } catch (RuntimeException e) {
            LOG.warnv("Model health check failed: {0}", e.getMessage());
            return ComponentHealth.unhealthy(NAME, e.getMessage());
        }
    }
}
