package appraiser.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code appraiser.rate-limiting}
 *
 * <p>Limits are fixed windows per client address. Anonymous key issuance and token
 * exchange get tighter budgets than prediction traffic.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code APPRAISER_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code APPRAISER_RATE_LIMITING_GENERAL_REQUESTS} - Prediction requests per window</li>
 * </ul>
 */
@ConfigMapping(prefix = "appraiser.rate-limiting")
public interface RateLimitConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Include X-RateLimit-* headers in responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Key issuance requests per window.
     *
     * @return requests per window (default: 10)
     */
    @WithDefault("10")
    long keyIssuanceRequests();

    /**
     * Key issuance window in seconds.
     *
     * @return window duration (default: 3600)
     */
    @WithDefault("3600")
    long keyIssuanceWindowSeconds();

    /**
     * Token exchange requests per window.
     *
     * @return requests per window (default: 30)
     */
    @WithDefault("30")
    long tokenExchangeRequests();

    @WithDefault("60")
    long tokenExchangeWindowSeconds();

    /**
     * Requests per window for authenticated prediction traffic.
     *
     * @return requests per window (default: 100)
     */
    @WithDefault("100")
    long generalRequests();

    @WithDefault("60")
    long generalWindowSeconds();
}
