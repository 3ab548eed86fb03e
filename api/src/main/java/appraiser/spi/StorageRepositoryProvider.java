package appraiser.spi;

import java.util.Optional;

import appraiser.core.port.out.CredentialRepository;
import appraiser.core.port.out.PredictionLogRepository;
import appraiser.core.port.out.StorageHealthIndicator;

/**
 * Service Provider Interface for credential and audit storage.
 *
 * <p>Implementations are discovered via java.util.ServiceLoader at startup. One
 * provider backs both repositories, because hard-deleting a key must detach its
 * audit entries in the same store.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/appraiser.spi.StorageRepositoryProvider</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: appraiser.storage.provider=your-provider-name</li>
 * </ol>
 */
public interface StorageRepositoryProvider {

    /**
     * Unique name identifying this provider.
     *
     * <p>Used in configuration: appraiser.storage.provider={name}
     *
     * @return The provider name
     */
    String name();

    /**
     * Human-readable description of this provider.
     *
     * @return Description for logging and diagnostics
     */
    default String description() {
        return name() + " storage provider";
    }

    /**
     * Priority for auto-selection when no explicit provider is configured.
     *
     * <p>Higher values = higher priority. Built-in providers use memory: 0, jdbc: 10.
     *
     * @return The provider priority
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available (dependencies present, etc.)
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create the credential repository. Called once at startup.
     *
     * @param settings provider settings
     * @return Repository implementation
     * @throws StorageProviderException if initialization fails
     */
    CredentialRepository createCredentialRepository(StorageSettings settings);

    /**
     * Create the audit repository. Called once at startup.
     *
     * @param settings provider settings
     * @return Repository implementation
     * @throws StorageProviderException if initialization fails
     */
    PredictionLogRepository createPredictionLogRepository(StorageSettings settings);

    /**
     * Optionally provide a health indicator for this storage backend.
     *
     * @param settings provider settings
     * @return Health indicator, or empty if not supported
     */
    default Optional<StorageHealthIndicator> createHealthIndicator(StorageSettings settings) {
        return Optional.empty();
    }
}
