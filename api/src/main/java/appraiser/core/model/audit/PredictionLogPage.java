package appraiser.core.model.audit;

import java.util.List;

/**
 * A page of audit entries with the caller's total count.
 */
public record PredictionLogPage(List<PredictionLog> logs, long total, int skip, int limit) {

    public PredictionLogPage {
        logs = logs == null ? List.of() : List.copyOf(logs);
    }
}
