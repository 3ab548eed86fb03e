package appraiser.core.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the regression model.
 *
 * <p>Configuration prefix: {@code appraiser.model}
 *
 * <h2>Example</h2>
 * <pre>
 * appraiser.model.path=/models/housing.json   # load from disk
 * appraiser.model.resource=model/linear-model.json   # classpath fallback
 * </pre>
 */
@ConfigMapping(prefix = "appraiser.model")
public interface ModelConfig {

    /**
     * Filesystem path of the model file. Takes precedence over {@link #resource()}.
     *
     * @return the path, or empty to load from the classpath
     */
    Optional<String> path();

    /**
     * Classpath location of the bundled model.
     *
     * @return resource name (default: model/linear-model.json)
     */
    @WithDefault("model/linear-model.json")
    String resource();
}
