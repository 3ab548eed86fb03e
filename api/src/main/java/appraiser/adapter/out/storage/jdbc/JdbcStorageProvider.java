package appraiser.adapter.out.storage.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

import javax.sql.DataSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;

import appraiser.core.model.ComponentHealth;
import appraiser.core.port.out.CredentialRepository;
import appraiser.core.port.out.PredictionLogRepository;
import appraiser.core.port.out.StorageHealthIndicator;
import appraiser.spi.StorageProviderException;
import appraiser.spi.StorageRepositoryProvider;
import appraiser.spi.StorageSettings;

/**
 * Relational storage provider over the application datasource.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>appraiser.storage.jdbc.apply-schema - Create tables at startup (default: true)</li>
 * </ul>
 *
 * <p>The datasource itself is configured through {@code quarkus.datasource.*} and
 * handed over by the provider loader before any repository is created.
 */
public class JdbcStorageProvider implements StorageRepositoryProvider {

    private DataSource dataSource;
    private ObjectMapper objectMapper;
    private boolean schemaApplied;

    @Override
    public String name() {
        return "jdbc";
    }

    @Override
    public String description() {
        return "Relational storage over JDBC";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return dataSource != null;
    }

    /**
     * Supply the managed datasource and JSON mapper.
     */
    public void configure(DataSource dataSource, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
    }

    @Override
    public CredentialRepository createCredentialRepository(StorageSettings settings) {
        prepare(settings);
        return new JdbcCredentialRepository(dataSource);
    }

    @Override
    public PredictionLogRepository createPredictionLogRepository(StorageSettings settings) {
        prepare(settings);
        return new JdbcPredictionLogRepository(dataSource, objectMapper != null ? objectMapper : new ObjectMapper());
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageSettings settings) {
        return Optional.of(() -> Uni.createFrom()
                .item(this::ping)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool()));
    }

    private ComponentHealth ping() {
        if (dataSource == null) {
            return ComponentHealth.unhealthy("jdbc", "Datasource not configured");
        }
        long start = System.currentTimeMillis();
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(2)) {
                return ComponentHealth.unhealthy("jdbc", "Connection is not valid");
            }
            return ComponentHealth.healthy("jdbc", System.currentTimeMillis() - start);
        } catch (SQLException e) {
            return ComponentHealth.unhealthy("jdbc", e.getMessage());
        }
    }

    private synchronized void prepare(StorageSettings settings) {
        if (dataSource == null) {
            throw new StorageProviderException("JDBC storage selected but no datasource is configured");
        }
        if (!schemaApplied && settings.applySchema()) {
            JdbcSupport.applySchema(dataSource);
            schemaApplied = true;
        }
    }
}
