package appraiser.adapter.out.crypto;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.elytron.security.common.BcryptUtil;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import appraiser.core.port.out.SecretHasher;

/**
 * bcrypt implementation of {@link SecretHasher}.
 *
 * <p>Each hash embeds its own random salt and cost factor, so {@link #verify} needs
 * only the stored string. The cost is read from {@code appraiser.auth.bcrypt-cost}
 * (default 12); existing hashes keep verifying after the cost changes.
 */
@ApplicationScoped
public class BcryptSecretHasher implements SecretHasher {

    static final int MIN_COST = 4;
    static final int MAX_COST = 31;

    private final int cost;

    @Inject
    public BcryptSecretHasher(@ConfigProperty(name = "appraiser.auth.bcrypt-cost", defaultValue = "12") int cost) {
        if (cost < MIN_COST || cost > MAX_COST) {
            throw new IllegalArgumentException(
                    "appraiser.auth.bcrypt-cost must be between " + MIN_COST + " and " + MAX_COST);
        }
        this.cost = cost;
    }

    @Override
    public String hash(String plaintext) {
        return BcryptUtil.bcryptHash(plaintext, cost);
    }

    @Override
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || hash.isBlank()) {
            return false;
        }
        return BcryptUtil.matches(plaintext, hash);
    }
}
