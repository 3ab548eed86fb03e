package appraiser.adapter.out.storage.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.audit.PredictionLog;
import appraiser.core.port.out.PredictionLogRepository;

/**
 * In-memory implementation of PredictionLogRepository.
 *
 * <p>Data is NOT persisted across restarts.
 */
public class InMemoryPredictionLogRepository implements PredictionLogRepository {

    private static final Comparator<PredictionLog> NEWEST_FIRST = Comparator.comparing(PredictionLog::createdAt)
            .thenComparingLong(PredictionLog::id)
            .reversed();

    private final ConcurrentHashMap<Long, PredictionLog> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Uni<PredictionLog> save(PredictionLog log) {
        return Uni.createFrom().item(() -> store(log));
    }

    @Override
    public Uni<List<PredictionLog>> saveAll(List<PredictionLog> logs) {
        return Uni.createFrom().item(() -> {
            List<PredictionLog> stored = new ArrayList<>(logs.size());
            for (PredictionLog log : logs) {
                stored.add(store(log));
            }
            return stored;
        });
    }

    @Override
    public Uni<Optional<PredictionLog>> findById(long id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storage.get(id)));
    }

    @Override
    public Uni<List<PredictionLog>> findByApiKey(long apiKeyId, int skip, int limit) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(log -> Objects.equals(log.apiKeyId(), apiKeyId))
                .sorted(NEWEST_FIRST)
                .skip(skip)
                .limit(limit)
                .toList());
    }

    @Override
    public Uni<List<PredictionLog>> findByBatchId(String batchId) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(log -> batchId.equals(log.batchId()))
                .sorted(Comparator.comparingLong(PredictionLog::id))
                .toList());
    }

    @Override
    public Uni<Long> countByApiKey(long apiKeyId) {
        return Uni.createFrom().item(() -> storage.values().stream()
                .filter(log -> Objects.equals(log.apiKeyId(), apiKeyId))
                .count());
    }

    @Override
    public Uni<Long> countAll() {
        return Uni.createFrom().item(() -> (long) storage.size());
    }

    /**
     * Clear the key reference of every entry recorded for a removed key.
     *
     * @param apiKeyId the removed key
     */
    void detach(long apiKeyId) {
        storage.replaceAll((id, log) -> Objects.equals(log.apiKeyId(), apiKeyId) ? log.detached() : log);
    }

    private PredictionLog store(PredictionLog log) {
        PredictionLog stored = log.withId(sequence.incrementAndGet());
        storage.put(stored.id(), stored);
        return stored;
    }
}
