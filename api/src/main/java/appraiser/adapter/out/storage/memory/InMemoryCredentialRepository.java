package appraiser.adapter.out.storage.memory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.auth.Credential;
import appraiser.core.model.auth.CredentialCollisionException;
import appraiser.core.model.auth.NewCredential;
import appraiser.core.port.out.CredentialRepository;

/**
 * In-memory implementation of CredentialRepository.
 *
 * <p>Data is NOT persisted across restarts. This implementation is suitable for
 * development, tests, and as a fallback when no persistent provider is available.
 *
 * <p>This class is instantiated by {@link InMemoryStorageProvider}.
 *
 * <p>Thread-safety: writes synchronize on one lock so the id and hash indexes stay
 * consistent; reads use the concurrent maps directly.
 */
public class InMemoryCredentialRepository implements CredentialRepository {

    private final ConcurrentHashMap<Long, Credential> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> idsByHash = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Object writeLock = new Object();
    private final InMemoryPredictionLogRepository logs;

    public InMemoryCredentialRepository(InMemoryPredictionLogRepository logs) {
        this.logs = logs;
    }

    @Override
    public Uni<Credential> create(NewCredential credential) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                if (idsByHash.containsKey(credential.secretHash())) {
                    throw new CredentialCollisionException("Secret hash already stored");
                }
                Credential stored = credential.withId(sequence.incrementAndGet());
                storageById.put(stored.id(), stored);
                idsByHash.put(stored.secretHash(), stored.id());
                return stored;
            }
        });
    }

    @Override
    public Uni<Optional<Credential>> findById(long id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(id)));
    }

    @Override
    public Uni<List<Credential>> findUsableByPrefix(String secretPrefix) {
        return Uni.createFrom().item(() -> storageById.values().stream()
                .filter(Credential::isUsable)
                .filter(c -> c.secretPrefix().equals(secretPrefix))
                .toList());
    }

    @Override
    public Uni<List<Credential>> findAll(int skip, int limit, boolean includeDeleted) {
        return Uni.createFrom().item(() -> storageById.values().stream()
                .filter(c -> includeDeleted || !c.isDeleted())
                .sorted(Comparator.comparingLong(Credential::id))
                .skip(skip)
                .limit(limit)
                .toList());
    }

    @Override
    public Uni<Boolean> update(Credential credential) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                if (!storageById.containsKey(credential.id())) {
                    return false;
                }
                storageById.put(credential.id(), credential);
                return true;
            }
        });
    }

    @Override
    public Uni<Boolean> hardDelete(long id) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                Credential removed = storageById.remove(id);
                if (removed == null) {
                    return false;
                }
                idsByHash.remove(removed.secretHash());
                logs.detach(id);
                return true;
            }
        });
    }
}
