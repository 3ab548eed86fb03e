package appraiser.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.container.ContainerRequestContext;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import appraiser.adapter.in.http.CorrelationId;
import appraiser.core.model.InvalidRequestException;

class GlobalExceptionMappersTest {

    @ParameterizedTest
    @CsvSource({
        "housingMedianAge, housing_median_age",
        "totalRooms, total_rooms",
        "oceanProximity, ocean_proximity",
        "houses, houses",
        "apiKey, api_key"
    })
    void shouldRenderWireFieldNames(String property, String expected) {
        assertEquals(expected, GlobalExceptionMappers.snakeCase(property));
    }

    @Nested
    @DisplayName("Argument failures")
    class ArgumentFailureTests {

        private final GlobalExceptionMappers mappers = new GlobalExceptionMappers();
        private ContainerRequestContext ctx;

        @BeforeEach
        void setUp() {
            ctx = mock(ContainerRequestContext.class);
            when(ctx.getProperty(CorrelationId.PROPERTY)).thenReturn("corr-1");
        }

        @Test
        @DisplayName("should render rejected client input as a validation problem")
        void shouldMapInvalidRequestTo422() {
            var response = mappers.mapInvalidRequest(new InvalidRequestException("Batch too large"), ctx);

            assertEquals(422, response.getStatus());
            assertEquals("Validation error", ((HttpProblem) response.getEntity()).getDetail());
        }

        @Test
        @DisplayName("should treat other illegal arguments as server errors")
        void shouldMapPlainIllegalArgumentTo500() {
            var response = mappers.mapUnexpected(new IllegalArgumentException("row has wrong width"), ctx);

            assertEquals(500, response.getStatus());
            assertEquals("Internal server error", ((HttpProblem) response.getEntity()).getDetail());
        }
    }
}
