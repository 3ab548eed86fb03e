package appraiser.core.model.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * A minted session token.
 *
 * @param token     compact JWS serialization
 * @param expiresAt absolute expiry
 * @param lifetime  time to live the token was minted with
 */
public record SessionToken(String token, Instant expiresAt, Duration lifetime) {

    public static final String TOKEN_TYPE = "bearer";

    public long expiresInSeconds() {
        return lifetime.toSeconds();
    }

    @Override
    public String toString() {
        return "SessionToken[expiresAt=" + expiresAt + ", token=[REDACTED]]";
    }
}
