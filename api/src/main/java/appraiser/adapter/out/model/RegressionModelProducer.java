package appraiser.adapter.out.model;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.Startup;
import org.jboss.logging.Logger;

import appraiser.adapter.out.model.LinearRegressionModel.ModelLoadException;
import appraiser.core.config.ModelConfig;
import appraiser.core.port.out.RegressionModel;
import appraiser.core.service.prediction.FeatureEncoder;

/**
 * Loads the regression model once at startup and exposes it as a bean.
 *
 * <p>A missing or inconsistent model stops the application.
 */
@ApplicationScoped
public class RegressionModelProducer {

    private static final Logger LOG = Logger.getLogger(RegressionModelProducer.class);

    private final ModelConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public RegressionModelProducer(ModelConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Produces
    @Startup
    @ApplicationScoped
    public RegressionModel regressionModel() {
        LinearRegressionModel model = config.path().map(this::loadFile).orElseGet(this::loadResource);
        if (model.featureCount() != FeatureEncoder.COLUMN_COUNT) {
            throw new ModelLoadException("Model expects " + model.featureCount() + " features, encoder produces "
                    + FeatureEncoder.COLUMN_COUNT);
        }
        LOG.infof("Loaded model %s v%s (%d features)", model.name(), model.version(), model.featureCount());
        return model;
    }

    private LinearRegressionModel loadFile(String location) {
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new ModelLoadException("Model file not found: " + path);
        }
        LOG.infof("Loading model from: %s", path);
        try (InputStream in = Files.newInputStream(path)) {
            return LinearRegressionModel.read(in, objectMapper);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read model file " + path, e);
        }
    }

    private LinearRegressionModel loadResource() {
        String resource = config.resource();
        LOG.infof("Loading model from classpath: %s", resource);
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ModelLoadException("Model resource not found: " + resource);
            }
            return LinearRegressionModel.read(in, objectMapper);
        } catch (IOException e) {
            throw new ModelLoadException("Failed to read model resource " + resource, e);
        }
    }
}
