package appraiser.core.port.out;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.audit.PredictionLog;

/**
 * Port interface for the prediction audit trail.
 */
public interface PredictionLogRepository {

    /**
     * Append one entry.
     *
     * @param log the entry to store
     * @return Uni with the stored entry, identity assigned
     */
    Uni<PredictionLog> save(PredictionLog log);

    /**
     * Append the entries of one batch in a single commit.
     *
     * @param logs the entries to store
     * @return Uni with the stored entries in input order
     */
    Uni<List<PredictionLog>> saveAll(List<PredictionLog> logs);

    Uni<Optional<PredictionLog>> findById(long id);

    /**
     * Entries recorded for one key, newest first.
     *
     * @param apiKeyId the owning key
     * @param skip entries to skip
     * @param limit maximum entries to return
     * @return Uni with the page
     */
    Uni<List<PredictionLog>> findByApiKey(long apiKeyId, int skip, int limit);

    /**
     * Entries of one batch in insertion order.
     */
    Uni<List<PredictionLog>> findByBatchId(String batchId);

    Uni<Long> countByApiKey(long apiKeyId);

    Uni<Long> countAll();
}
