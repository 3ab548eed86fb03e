package appraiser.core.service.auth;

import appraiser.core.port.out.SecretHasher;

/**
 * Fast stand-in for bcrypt in unit tests. Hashes are distinct for distinct secrets.
 */
final class ReversibleHasher implements SecretHasher {

    private static final String PREFIX = "test-hash:";

    @Override
    public String hash(String plaintext) {
        return PREFIX + new StringBuilder(plaintext).reverse();
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        return plaintext != null && hash(plaintext).equals(hash);
    }
}
