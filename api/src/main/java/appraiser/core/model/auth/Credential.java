package appraiser.core.model.auth;

import java.time.Instant;

/**
 * A stored API key.
 *
 * <p>The plaintext secret is never stored; only its bcrypt hash and the first
 * {@value #PREFIX_LENGTH} characters (used to narrow validation candidates) are
 * persisted.
 *
 * @param id            stable identity, used as the session token subject
 * @param name          display name (not unique)
 * @param description   optional description, null when absent
 * @param secretHash    salted slow hash of the secret (never returned to clients)
 * @param secretPrefix  first characters of the plaintext secret
 * @param state         lifecycle state
 * @param createdAt     when the key was issued
 * @param updatedAt     when the key was last mutated
 * @param deactivatedAt when the key was deactivated (null if never)
 * @param deletedAt     when the key was soft-deleted (null unless {@link CredentialState#DELETED})
 */
public record Credential(
        long id,
        String name,
        String description,
        String secretHash,
        String secretPrefix,
        CredentialState state,
        Instant createdAt,
        Instant updatedAt,
        Instant deactivatedAt,
        Instant deletedAt) {

    public static final int PREFIX_LENGTH = 8;

    public Credential {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Credential name cannot be null or empty");
        }
        if (secretHash == null || secretHash.isBlank()) {
            throw new IllegalArgumentException("Credential secret hash cannot be null or blank");
        }
        if (secretPrefix == null || secretPrefix.length() != PREFIX_LENGTH) {
            throw new IllegalArgumentException("Credential secret prefix must be " + PREFIX_LENGTH + " characters");
        }
        if (state == null) {
            throw new IllegalArgumentException("Credential state cannot be null");
        }
        if ((state == CredentialState.DELETED) != (deletedAt != null)) {
            throw new IllegalArgumentException("deletedAt must be set exactly when the credential is deleted");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Checks whether this key may authenticate.
     *
     * @return true if the key is active
     */
    public boolean isUsable() {
        return state.isUsable();
    }

    public boolean isDeleted() {
        return state == CredentialState.DELETED;
    }

    /**
     * Creates a deactivated copy of this key.
     *
     * <p>Deactivating a deleted key keeps it deleted, but a later restore will
     * bring it back deactivated.
     *
     * @param now mutation time
     * @return the deactivated key
     */
    public Credential deactivate(Instant now) {
        Instant since = deactivatedAt != null ? deactivatedAt : now;
        CredentialState next = state == CredentialState.DELETED ? CredentialState.DELETED : CredentialState.DEACTIVATED;
        return new Credential(
                id, name, description, secretHash, secretPrefix, next, createdAt, now, since, deletedAt);
    }

    /**
     * Creates a soft-deleted copy of this key.
     *
     * @param now mutation time, recorded as the deletion time
     * @return the deleted key
     */
    public Credential softDelete(Instant now) {
        return new Credential(
                id,
                name,
                description,
                secretHash,
                secretPrefix,
                CredentialState.DELETED,
                createdAt,
                now,
                deactivatedAt,
                now);
    }

    /**
     * Creates a restored copy of a soft-deleted key.
     *
     * @param now mutation time
     * @return the key in the state it had before deletion
     * @throws IllegalStateException if the key is not deleted
     */
    public Credential restore(Instant now) {
        if (!isDeleted()) {
            throw new IllegalStateException("Credential " + id + " is not deleted");
        }
        CredentialState previous = deactivatedAt != null ? CredentialState.DEACTIVATED : CredentialState.ACTIVE;
        return new Credential(
                id, name, description, secretHash, secretPrefix, previous, createdAt, now, deactivatedAt, null);
    }
}
