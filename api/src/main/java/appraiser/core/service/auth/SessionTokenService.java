package appraiser.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import appraiser.core.config.TokenConfig;
import appraiser.core.model.auth.Credential;
import appraiser.core.model.auth.SessionClaims;
import appraiser.core.model.auth.SessionToken;
import appraiser.core.model.auth.TokenVerification;

/**
 * Mints and verifies HS256 session tokens.
 *
 * <p>Tokens carry the {@link SessionClaims} fields plus the issuer and issue time.
 * Verification requires a valid HMAC-SHA256 signature, the configured issuer, the
 * current claim version and an expiry strictly in the future. This service never
 * touches storage.
 *
 * <p>The bean is created at startup so a missing or short secret stops the
 * application instead of failing the first exchange.
 */
@Startup
@ApplicationScoped
public class SessionTokenService {

    private static final Logger LOG = Logger.getLogger(SessionTokenService.class);

    static final int MIN_SECRET_BYTES = 32;
    static final String NAME_CLAIM = "name";
    static final String VERSION_CLAIM = "ver";

    private final TokenConfig config;
    private final HmacKey signingKey;
    private final JwtConsumer consumer;

    @Inject
    public SessionTokenService(TokenConfig config) {
        this.config = config;
        this.signingKey = buildKey(config.secret());
        this.consumer = new JwtConsumerBuilder()
                .setRequireExpirationTime()
                .setRequireSubject()
                .setExpectedIssuer(config.issuer())
                .setAllowedClockSkewInSeconds(0)
                .setVerificationKey(signingKey)
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .build();
        LOG.infof("Session token service initialized (issuer=%s, ttl=%s)", config.issuer(), config.ttl());
    }

    /**
     * Mint a token for a validated key using the configured lifetime.
     *
     * @param credential the key the token is bound to
     * @return the minted token
     */
    public SessionToken mint(Credential credential) {
        return mint(credential.id(), credential.name(), config.ttl());
    }

    /**
     * Mint a token.
     *
     * @param credentialId subject of the token
     * @param name display name of the key
     * @param ttl lifetime; zero yields a token that is already expired
     * @return the minted token
     */
    public SessionToken mint(long credentialId, String name, Duration ttl) {
        Instant now = Instant.now();
        Instant expiresAt = Instant.ofEpochSecond(now.plus(ttl).getEpochSecond());
        SessionClaims claims = SessionClaims.of(credentialId, name, expiresAt);

        JwtClaims jwtClaims = new JwtClaims();
        jwtClaims.setIssuer(config.issuer());
        jwtClaims.setSubject(Long.toString(claims.subject()));
        jwtClaims.setIssuedAt(NumericDate.fromSeconds(now.getEpochSecond()));
        jwtClaims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        jwtClaims.setStringClaim(NAME_CLAIM, claims.name());
        jwtClaims.setClaim(VERSION_CLAIM, claims.version());

        JsonWebSignature jws = new JsonWebSignature();
        jws.setPayload(jwtClaims.toJson());
        jws.setKey(signingKey);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);

        try {
            String token = jws.getCompactSerialization();
            LOG.debugf("Minted session token for key %d, expires at %s", credentialId, expiresAt);
            return new SessionToken(token, expiresAt, ttl);
        } catch (JoseException e) {
            throw new TokenSigningException("Failed to sign session token", e);
        }
    }

    /**
     * Verify a token's signature, issuer and expiry.
     *
     * @param token compact serialization
     * @return the claims, or an invalid result for any defect
     */
    public TokenVerification verify(String token) {
        if (token == null || token.isBlank()) {
            return TokenVerification.invalid("missing token");
        }
        try {
            JwtClaims jwtClaims = consumer.processToClaims(token);
            long subject = Long.parseLong(jwtClaims.getSubject());
            Object name = jwtClaims.getClaimValue(NAME_CLAIM);
            Long version = jwtClaims.getClaimValue(VERSION_CLAIM, Long.class);
            if (!(name instanceof String) || version == null || version != SessionClaims.CURRENT_VERSION) {
                return TokenVerification.invalid("unexpected claim layout");
            }
            Instant expiresAt = Instant.ofEpochSecond(jwtClaims.getExpirationTime().getValue());
            SessionClaims claims = new SessionClaims(subject, (String) name, expiresAt, version.intValue());
            if (claims.isExpiredAt(Instant.now())) {
                return TokenVerification.invalid("expired");
            }
            return TokenVerification.valid(claims);
        } catch (InvalidJwtException e) {
            return TokenVerification.invalid(e.hasExpired() ? "expired" : "invalid token");
        } catch (MalformedClaimException | NumberFormatException e) {
            return TokenVerification.invalid("malformed claims");
        }
    }

    /**
     * Configured token lifetime.
     */
    public Duration ttl() {
        return config.ttl();
    }

    private static HmacKey buildKey(String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new TokenSigningException(
                    "appraiser.token.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return new HmacKey(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Thrown when tokens cannot be signed, including a misconfigured secret.
     */
    public static class TokenSigningException extends RuntimeException {
        public TokenSigningException(String message) {
            super(message);
        }

        public TokenSigningException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
