package appraiser.core.service.auth;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import appraiser.core.model.InvalidRequestException;
import appraiser.core.model.auth.Credential;
import appraiser.core.model.auth.CredentialCollisionException;
import appraiser.core.model.auth.CredentialIssueResult;
import appraiser.core.model.auth.NewCredential;
import appraiser.core.port.in.CredentialManagement;
import appraiser.core.port.out.CredentialRepository;
import appraiser.core.port.out.SecretHasher;
import appraiser.core.port.out.ServiceMetrics;

/**
 * Service for issuing, validating and retiring API keys.
 *
 * <p>Secrets are 32 random bytes rendered as 64 lowercase hex characters. Only a
 * bcrypt hash and the first {@value Credential#PREFIX_LENGTH} characters are stored;
 * the plaintext is returned once at issuance.
 *
 * <p>Validation narrows candidates by prefix and then verifies the presented secret
 * against every candidate hash, so two keys sharing a prefix never cross-validate.
 * Hashing runs on the worker pool.
 */
@ApplicationScoped
public class CredentialService implements CredentialManagement {

    private static final Logger LOG = Logger.getLogger(CredentialService.class);

    static final int SECRET_LENGTH_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final CredentialRepository repository;
    private final SecretHasher hasher;
    private final ServiceMetrics metrics;

    @Inject
    public CredentialService(CredentialRepository repository, SecretHasher hasher, ServiceMetrics metrics) {
        this.repository = repository;
        this.hasher = hasher;
        this.metrics = metrics;
    }

    @Override
    public Uni<CredentialIssueResult> issue(String name, String description) {
        if (name == null || name.isEmpty()) {
            return Uni.createFrom().failure(new InvalidRequestException("Key name cannot be empty"));
        }

        String plaintext = generateSecret();
        return blocking(() -> hasher.hash(plaintext))
                .map(hash -> new NewCredential(name, description, hash, prefixOf(plaintext), Instant.now()))
                .flatMap(repository::create)
                .invoke(stored -> {
                    metrics.recordKeyIssued();
                    LOG.infof("Issued API key %d (%s)", stored.id(), stored.name());
                })
                .onFailure(CredentialCollisionException.class)
                .invoke(e -> LOG.errorf(e, "Secret hash collision while issuing key '%s'", name))
                .map(stored -> new CredentialIssueResult(stored, plaintext));
    }

    @Override
    public Uni<Optional<Credential>> validate(String plaintext) {
        if (plaintext == null || plaintext.length() < Credential.PREFIX_LENGTH) {
            return Uni.createFrom().item(Optional.empty());
        }

        String prefix = prefixOf(plaintext);
        return repository.findUsableByPrefix(prefix).flatMap(candidates -> {
            if (candidates.isEmpty()) {
                LOG.debugv("No usable key matches prefix {0}", prefix);
                return Uni.createFrom().item(Optional.<Credential>empty());
            }
            if (candidates.size() > 1) {
                LOG.debugv("{0} keys share prefix {1}", candidates.size(), prefix);
            }
            return blocking(() -> firstMatch(plaintext, candidates));
        });
    }

    @Override
    public Uni<List<Credential>> list(int skip, int limit) {
        return repository.findAll(Math.max(0, skip), Math.max(0, limit), false);
    }

    @Override
    public Uni<Optional<Credential>> get(long id) {
        return repository.findById(id);
    }

    @Override
    public Uni<Boolean> deactivate(long id) {
        return repository.findById(id).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            Credential current = existing.get();
            if (current.deactivatedAt() != null) {
                return Uni.createFrom().item(true);
            }
            return repository
                    .update(current.deactivate(Instant.now()))
                    .invoke(updated -> LOG.infof("Deactivated API key %d", id));
        });
    }

    @Override
    public Uni<Boolean> delete(long id, boolean hard) {
        if (hard) {
            return repository
                    .hardDelete(id)
                    .invoke(removed -> {
                        if (removed) {
                            LOG.infof("Hard-deleted API key %d", id);
                        }
                    });
        }
        return repository.findById(id).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            Credential current = existing.get();
            if (current.isDeleted()) {
                return Uni.createFrom().item(true);
            }
            return repository
                    .update(current.softDelete(Instant.now()))
                    .invoke(updated -> LOG.infof("Soft-deleted API key %d", id));
        });
    }

    @Override
    public Uni<Optional<Credential>> restore(long id) {
        return repository.findById(id).flatMap(existing -> {
            if (existing.isEmpty() || !existing.get().isDeleted()) {
                return Uni.createFrom().item(Optional.<Credential>empty());
            }
            Credential restored = existing.get().restore(Instant.now());
            return repository.update(restored).map(updated -> {
                if (!updated) {
                    return Optional.<Credential>empty();
                }
                LOG.infof("Restored API key %d as %s", id, restored.state());
                return Optional.of(restored);
            });
        });
    }

    private Optional<Credential> firstMatch(String plaintext, List<Credential> candidates) {
        for (Credential candidate : candidates) {
            if (candidate.isUsable() && hasher.verify(plaintext, candidate.secretHash())) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static <T> Uni<T> blocking(Supplier<T> work) {
        return Uni.createFrom().item(work).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    /**
     * Generates a cryptographically secure random secret.
     *
     * @return 64-character lowercase hex string
     */
    static String generateSecret() {
        byte[] bytes = new byte[SECRET_LENGTH_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    static String prefixOf(String plaintext) {
        return plaintext.substring(0, Credential.PREFIX_LENGTH);
    }
}
