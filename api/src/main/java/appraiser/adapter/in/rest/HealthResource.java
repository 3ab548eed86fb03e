package appraiser.adapter.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.Readiness;

import appraiser.adapter.in.dto.HealthResponse;
import appraiser.adapter.in.dto.RootResponse;
import appraiser.adapter.in.health.DatabaseHealthCheck;
import appraiser.adapter.in.health.ModelHealthCheck;
import appraiser.core.config.ServiceInfoConfig;
import appraiser.core.model.ComponentHealth;

/**
 * Anonymous service information and health endpoints.
 *
 * <p>The MicroProfile Health view of the same components is published under
 * {@code /q/health}.
 */
@Path("/")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    private final ServiceInfoConfig info;
    private final DatabaseHealthCheck database;
    private final ModelHealthCheck model;

    @Inject
    public HealthResource(
            ServiceInfoConfig info, @Readiness DatabaseHealthCheck database, @Readiness ModelHealthCheck model) {
        this.info = info;
        this.database = database;
        this.model = model;
    }

    @GET
    public RootResponse root() {
        return new RootResponse(info.name(), info.version(), "/docs", "/health");
    }

    @GET
    @Path("/health")
    public HealthResponse health() {
        return new HealthResponse(HealthResponse.HEALTHY, Instant.now(), info.version(), info.environment(), null);
    }

    /**
     * Health including the datastore and model. Overall status is degraded when any
     * component is unhealthy; the response itself is still 200.
     */
    @GET
    @Path("/health/detailed")
    public Uni<HealthResponse> detailedHealth() {
        return database.component().map(db -> {
            ComponentHealth modelHealth = model.component();
            Map<String, String> components = new LinkedHashMap<>();
            components.put(db.name(), statusOf(db));
            components.put(modelHealth.name(), statusOf(modelHealth));
            String status = db.healthy() && modelHealth.healthy() ? HealthResponse.HEALTHY : HealthResponse.DEGRADED;
            return new HealthResponse(status, Instant.now(), info.version(), info.environment(), components);
        });
    }

    private static String statusOf(ComponentHealth health) {
        return health.healthy() ? HealthResponse.HEALTHY : HealthResponse.UNHEALTHY;
    }
}
