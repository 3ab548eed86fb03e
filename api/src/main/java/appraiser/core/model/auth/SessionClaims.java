package appraiser.core.model.auth;

import java.time.Instant;

/**
 * Claims carried by a session token.
 *
 * <p>The claim set is fixed. {@link #version()} is written to the token so the shape
 * can evolve without misreading older tokens.
 *
 * @param subject   credential id the token was minted for
 * @param name      credential display name at mint time
 * @param expiresAt absolute expiry
 * @param version   claim layout version
 */
public record SessionClaims(long subject, String name, Instant expiresAt, int version) {

    public static final int CURRENT_VERSION = 1;

    public SessionClaims {
        if (name == null) {
            throw new IllegalArgumentException("Claim name cannot be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Claim expiry cannot be null");
        }
    }

    public static SessionClaims of(long subject, String name, Instant expiresAt) {
        return new SessionClaims(subject, name, expiresAt, CURRENT_VERSION);
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
