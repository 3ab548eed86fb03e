package appraiser.adapter.out.storage.memory;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.ComponentHealth;
import appraiser.core.port.out.CredentialRepository;
import appraiser.core.port.out.PredictionLogRepository;
import appraiser.core.port.out.StorageHealthIndicator;
import appraiser.spi.StorageRepositoryProvider;
import appraiser.spi.StorageSettings;

/**
 * In-memory storage provider.
 *
 * <p>Provides non-persistent storage suitable for development and testing.
 * Data is NOT persisted across application restarts.
 */
public class InMemoryStorageProvider implements StorageRepositoryProvider {

    private InMemoryPredictionLogRepository logRepository;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory storage (non-persistent)";
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public CredentialRepository createCredentialRepository(StorageSettings settings) {
        return new InMemoryCredentialRepository(sharedLogRepository());
    }

    @Override
    public PredictionLogRepository createPredictionLogRepository(StorageSettings settings) {
        return sharedLogRepository();
    }

    @Override
    public Optional<StorageHealthIndicator> createHealthIndicator(StorageSettings settings) {
        return Optional.of(() -> Uni.createFrom().item(ComponentHealth.healthy("memory", 0)));
    }

    private synchronized InMemoryPredictionLogRepository sharedLogRepository() {
        if (logRepository == null) {
            logRepository = new InMemoryPredictionLogRepository();
        }
        return logRepository;
    }
}
