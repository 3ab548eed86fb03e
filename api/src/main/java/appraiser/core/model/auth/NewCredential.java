package appraiser.core.model.auth;

import java.time.Instant;

/**
 * A key about to be persisted, before the store has assigned its identity.
 *
 * @param name         display name
 * @param description  optional description
 * @param secretHash   salted slow hash of the secret
 * @param secretPrefix first characters of the plaintext secret
 * @param createdAt    issuance time
 */
public record NewCredential(
        String name, String description, String secretHash, String secretPrefix, Instant createdAt) {

    public NewCredential {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Credential name cannot be null or empty");
        }
        if (secretHash == null || secretHash.isBlank()) {
            throw new IllegalArgumentException("Credential secret hash cannot be null or blank");
        }
        if (secretPrefix == null || secretPrefix.length() != Credential.PREFIX_LENGTH) {
            throw new IllegalArgumentException(
                    "Credential secret prefix must be " + Credential.PREFIX_LENGTH + " characters");
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Binds this draft to its assigned identity.
     *
     * @param id identity assigned by the store
     * @return the active credential
     */
    public Credential withId(long id) {
        return new Credential(
                id,
                name,
                description,
                secretHash,
                secretPrefix,
                CredentialState.ACTIVE,
                createdAt,
                createdAt,
                null,
                null);
    }
}
