package appraiser.core.model.auth;

/**
 * Thrown when a freshly issued secret hashes to a value already stored.
 *
 * <p>A collision means the secret generator is broken. The issuance is aborted and
 * nothing is persisted.
 */
public class CredentialCollisionException extends RuntimeException {

    public CredentialCollisionException(String message) {
        super(message);
    }

    public CredentialCollisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
