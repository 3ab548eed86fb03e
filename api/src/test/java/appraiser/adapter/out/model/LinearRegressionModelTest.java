package appraiser.adapter.out.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import appraiser.core.service.prediction.FeatureEncoder;

@DisplayName("LinearRegressionModel")
class LinearRegressionModelTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static InputStream json(String body) {
        return new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should add the intercept to the weighted sum")
    void shouldPredict() {
        var model = LinearRegressionModel.read(
                json("{\"name\":\"tiny\",\"version\":\"2\",\"features\":[\"a\",\"b\"],"
                        + "\"intercept\":10.0,\"coefficients\":[2.0,-3.0],\"trained_on\":\"ignored\"}"),
                objectMapper);

        assertEquals("tiny", model.name());
        assertEquals("2", model.version());
        assertEquals(List.of("a", "b"), model.featureNames());
        assertEquals(2, model.featureCount());
        assertEquals(10.0 + 2.0 * 4.0 - 3.0 * 5.0, model.predict(new double[] {4.0, 5.0}));
    }

    @Test
    @DisplayName("should reject input of the wrong width")
    void shouldRejectWrongWidth() {
        var model = new LinearRegressionModel("m", "1", null, 0.0, new double[] {1.0, 1.0});

        assertThrows(IllegalArgumentException.class, () -> model.predict(new double[] {1.0}));
    }

    @Test
    @DisplayName("should fail to load malformed or inconsistent documents")
    void shouldRejectBadDocuments() {
        assertThrows(
                LinearRegressionModel.ModelLoadException.class,
                () -> LinearRegressionModel.read(json("{not json"), objectMapper));
        assertThrows(
                LinearRegressionModel.ModelLoadException.class,
                () -> LinearRegressionModel.read(
                        json("{\"features\":[\"a\"],\"intercept\":0,\"coefficients\":[1.0,2.0]}"), objectMapper));
        assertThrows(
                LinearRegressionModel.ModelLoadException.class,
                () -> LinearRegressionModel.read(json("{\"intercept\":0,\"coefficients\":[]}"), objectMapper));
    }

    @Test
    @DisplayName("should ship a bundled model matching the encoder layout")
    void shouldLoadBundledModel() throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("model/linear-model.json")) {
            var model = LinearRegressionModel.read(in, objectMapper);

            assertEquals(FeatureEncoder.COLUMN_COUNT, model.featureCount());
            assertEquals(FeatureEncoder.COLUMN_COUNT, model.featureNames().size());
        }
    }
}
