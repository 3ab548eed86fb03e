package appraiser.adapter.in.dto;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Service health. {@code components} is only present on the detailed view.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        String status, Instant timestamp, String version, String environment, Map<String, String> components) {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";
    public static final String DEGRADED = "degraded";
}
