package appraiser.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for session tokens.
 *
 * <p>Configuration prefix: {@code appraiser.token}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code APPRAISER_TOKEN_SECRET} - HMAC signing secret, at least 32 bytes (required)</li>
 *   <li>{@code APPRAISER_TOKEN_TTL} - Token lifetime (default: PT30M)</li>
 *   <li>{@code APPRAISER_TOKEN_ISSUER} - Issuer claim (default: appraiser)</li>
 * </ul>
 */
@ConfigMapping(prefix = "appraiser.token")
public interface TokenConfig {

    /**
     * HMAC-SHA256 signing secret.
     *
     * <p>The application refuses to start when the secret is shorter than 32 bytes.
     *
     * @return the signing secret
     */
    String secret();

    /**
     * Lifetime of minted tokens.
     *
     * @return token lifetime (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration ttl();

    /**
     * Issuer claim written to and required on every token.
     *
     * @return the issuer (default: appraiser)
     */
    @WithDefault("appraiser")
    String issuer();
}
