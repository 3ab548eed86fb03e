package appraiser.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import appraiser.adapter.out.storage.jdbc.JdbcStorageProvider;
import appraiser.core.port.out.CredentialRepository;
import appraiser.core.port.out.PredictionLogRepository;
import appraiser.core.port.out.StorageHealthIndicator;
import appraiser.spi.StorageProviderException;
import appraiser.spi.StorageRepositoryProvider;
import appraiser.spi.StorageSettings;

/**
 * Discovers and loads storage providers via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If appraiser.storage.provider is set, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class StorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(StorageProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final StorageSettings settings;
    private final Optional<AgroalDataSource> dataSource;
    private final ObjectMapper objectMapper;

    private StorageRepositoryProvider provider;

    @Inject
    public StorageProviderLoader(
            @ConfigProperty(name = "appraiser.storage.provider") Optional<String> configuredProvider,
            @ConfigProperty(name = "appraiser.storage.jdbc.apply-schema", defaultValue = "true") boolean applySchema,
            Instance<AgroalDataSource> dataSourceInstance,
            ObjectMapper objectMapper) {
        this.configuredProvider = configuredProvider;
        this.settings = new StorageSettings(applySchema);
        this.dataSource = dataSourceInstance.isResolvable() ? Optional.of(dataSourceInstance.get()) : Optional.empty();
        this.objectMapper = objectMapper;
    }

    @Produces
    @ApplicationScoped
    public CredentialRepository credentialRepository() {
        StorageRepositoryProvider selected = getProvider();
        LOG.infof("Creating credential repository from provider: %s (%s)", selected.name(), selected.description());
        return selected.createCredentialRepository(settings);
    }

    @Produces
    @ApplicationScoped
    public PredictionLogRepository predictionLogRepository() {
        StorageRepositoryProvider selected = getProvider();
        LOG.infof("Creating prediction log repository from provider: %s", selected.name());
        return selected.createPredictionLogRepository(settings);
    }

    @Produces
    @ApplicationScoped
    public List<StorageHealthIndicator> storageHealthIndicators() {
        List<StorageHealthIndicator> indicators = new ArrayList<>();
        getProvider().createHealthIndicator(settings).ifPresent(indicators::add);
        return indicators;
    }

    private synchronized StorageRepositoryProvider getProvider() {
        if (provider != null) {
            return provider;
        }

        List<StorageRepositoryProvider> providers = new ArrayList<>();
        ServiceLoader.load(StorageRepositoryProvider.class).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new StorageProviderException(
                    "No storage providers found. Ensure a provider JAR is on the classpath.");
        }

        // Hand the managed datasource to the JDBC provider before availability is checked
        for (StorageRepositoryProvider candidate : providers) {
            if (candidate instanceof JdbcStorageProvider jdbc && dataSource.isPresent()) {
                jdbc.configure(dataSource.get(), objectMapper);
            }
        }

        LOG.infof(
                "Found %d storage provider(s): %s",
                providers.size(),
                providers.stream().map(StorageRepositoryProvider::name).toList());

        provider = selectProvider(providers, configuredProvider.orElse(null));
        return provider;
    }

    private StorageRepositoryProvider selectProvider(List<StorageRepositoryProvider> providers, String configured) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new StorageProviderException("Configured storage provider not found: "
                            + configured + ". Available: "
                            + providers.stream().map(StorageRepositoryProvider::name).toList()));
        }

        return providers.stream()
                .filter(StorageRepositoryProvider::isAvailable)
                .max(Comparator.comparingInt(StorageRepositoryProvider::priority))
                .orElseThrow(() -> new StorageProviderException("No available storage providers"));
    }
}
