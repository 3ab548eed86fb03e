package appraiser.core.service.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appraiser.core.model.audit.LogAccess;
import appraiser.core.model.audit.PredictionLogPage;
import appraiser.core.model.audit.PredictionStats;
import appraiser.core.model.auth.AuthenticatedCaller;
import appraiser.core.port.in.PredictionLogQuery;
import appraiser.core.port.out.PredictionLogRepository;

/**
 * Read access to the audit trail. Callers only see entries recorded for their own key.
 */
@ApplicationScoped
public class PredictionLogService implements PredictionLogQuery {

    private static final Logger LOG = Logger.getLogger(PredictionLogService.class);

    private final PredictionLogRepository repository;

    @Inject
    public PredictionLogService(PredictionLogRepository repository) {
        this.repository = repository;
    }

    @Override
    public Uni<PredictionLogPage> listOwn(AuthenticatedCaller caller, int skip, int limit) {
        int safeSkip = Math.max(0, skip);
        int safeLimit = Math.max(0, limit);
        return Uni.combine()
                .all()
                .unis(
                        repository.findByApiKey(caller.id(), safeSkip, safeLimit),
                        repository.countByApiKey(caller.id()))
                .asTuple()
                .map(t -> new PredictionLogPage(t.getItem1(), t.getItem2(), safeSkip, safeLimit));
    }

    @Override
    public Uni<PredictionStats> stats(AuthenticatedCaller caller) {
        return Uni.combine()
                .all()
                .unis(repository.countAll(), repository.countByApiKey(caller.id()))
                .asTuple()
                .map(t -> new PredictionStats(t.getItem1(), t.getItem2()));
    }

    @Override
    public Uni<LogAccess> get(AuthenticatedCaller caller, long logId) {
        return repository.findById(logId).map(found -> {
            if (found.isEmpty()) {
                return new LogAccess.NotFound(logId);
            }
            if (!caller.owns(found.get().apiKeyId())) {
                LOG.warnv("Key {0} attempted to read log {1} it does not own", caller.id(), logId);
                return new LogAccess.Forbidden(logId);
            }
            return new LogAccess.Granted(found.get());
        });
    }
}
