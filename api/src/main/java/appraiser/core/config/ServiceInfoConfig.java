package appraiser.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Descriptive service metadata reported by the health endpoints.
 *
 * <p>Configuration prefix: {@code appraiser.info}
 */
@ConfigMapping(prefix = "appraiser.info")
public interface ServiceInfoConfig {

    @WithDefault("Housing Price Prediction API")
    String name();

    @WithDefault("1.0.0")
    String version();

    /**
     * Deployment environment name (development, testing, production).
     */
    @WithDefault("development")
    String environment();
}
