package appraiser.core.model.auth;

/**
 * Result of issuing an API key.
 *
 * <p>Contains the plaintext secret, which is only available at issuance time.
 * The secret must be handed to the caller immediately as it cannot be recovered.
 *
 * @param credential the stored key metadata
 * @param plaintext  the plaintext secret (only available at issuance)
 */
public record CredentialIssueResult(Credential credential, String plaintext) {

    public CredentialIssueResult {
        if (credential == null) {
            throw new IllegalArgumentException("Credential cannot be null");
        }
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("Plaintext secret cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "CredentialIssueResult[credential=" + credential.id() + ", plaintext=[REDACTED]]";
    }
}
