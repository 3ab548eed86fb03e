package appraiser.core.port.out;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.ComponentHealth;

/**
 * Optional interface for storage health checks.
 *
 * <p>Providers may implement this to expose health status via the health endpoints.
 */
public interface StorageHealthIndicator {

    /**
     * Check if the storage backend is healthy.
     *
     * @return Uni with health status
     */
    Uni<ComponentHealth> check();
}
