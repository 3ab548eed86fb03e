package appraiser.core.port.out;

/**
 * Deliberately slow, salted one-way hash for API key secrets.
 *
 * <p>Both operations are CPU-bound and take tens of milliseconds. Callers must not
 * invoke them on an I/O thread.
 */
public interface SecretHasher {

    /**
     * Hash a secret with a fresh salt.
     *
     * @param plaintext the secret
     * @return the encoded hash, salt included
     */
    String hash(String plaintext);

    /**
     * Check a secret against an encoded hash.
     *
     * @param plaintext the presented secret
     * @param hash the stored hash
     * @return true if the secret produced the hash
     */
    boolean verify(String plaintext, String hash);
}
