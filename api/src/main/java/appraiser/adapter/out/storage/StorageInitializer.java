package appraiser.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import appraiser.core.port.out.CredentialRepository;
import appraiser.core.port.out.PredictionLogRepository;

/**
 * Opens the configured store on application startup, so schema creation and
 * connection failures surface before the first request.
 */
@ApplicationScoped
public class StorageInitializer {

    private static final Logger LOG = Logger.getLogger(StorageInitializer.class);

    private final CredentialRepository credentials;
    private final PredictionLogRepository logs;

    @Inject
    public StorageInitializer(CredentialRepository credentials, PredictionLogRepository logs) {
        this.credentials = credentials;
        this.logs = logs;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Initializing storage...");
        long keys = credentials.findAll(0, Integer.MAX_VALUE, true).await().indefinitely().size();
        long entries = logs.countAll().await().indefinitely();
        LOG.infof("Storage ready: %d API keys, %d prediction log entries", keys, entries);
    }
}
