package appraiser.core.model.audit;

/**
 * Outcome of reading a single audit entry on behalf of a caller.
 */
public sealed interface LogAccess {

    record Granted(PredictionLog log) implements LogAccess {}

    record NotFound(long logId) implements LogAccess {}

    record Forbidden(long logId) implements LogAccess {}
}
