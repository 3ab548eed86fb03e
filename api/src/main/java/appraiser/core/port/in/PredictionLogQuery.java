package appraiser.core.port.in;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.audit.LogAccess;
import appraiser.core.model.audit.PredictionLogPage;
import appraiser.core.model.audit.PredictionStats;
import appraiser.core.model.auth.AuthenticatedCaller;

/**
 * Port interface for reading the audit trail on behalf of a caller.
 */
public interface PredictionLogQuery {

    /**
     * The caller's own entries, newest first.
     */
    Uni<PredictionLogPage> listOwn(AuthenticatedCaller caller, int skip, int limit);

    Uni<PredictionStats> stats(AuthenticatedCaller caller);

    /**
     * Read one entry, enforcing ownership.
     */
    Uni<LogAccess> get(AuthenticatedCaller caller, long logId);
}
