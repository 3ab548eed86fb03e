package appraiser.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;

/**
 * Proxies whose forwarding headers are believed when identifying a client.
 *
 * <p>Configuration prefix: {@code appraiser.trusted-proxies}
 *
 * <p>With no entries, {@code Forwarded} and {@code X-Forwarded-For} are ignored and
 * clients are identified by the connection's remote address.
 */
@ConfigMapping(prefix = "appraiser.trusted-proxies")
public interface TrustedProxyConfig {

    /** @return trusted proxy IPs or CIDR ranges, e.g. {@code 10.0.0.0/8} */
    Optional<List<String>> proxies();
}
