package appraiser.adapter.in.problem;

import java.util.List;

import jakarta.ws.rs.core.Response.Status;
import jakarta.ws.rs.core.Response.StatusType;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for API errors.
 *
 * <p>The correlation id is added by {@link GlobalExceptionMappers} when the problem
 * is rendered.
 */
public final class ApiProblem {

    public static final String CORRELATION_ID = "correlation_id";

    /** 422 is not among the statuses {@link Status} enumerates. */
    static final StatusType UNPROCESSABLE_ENTITY = new StatusType() {
        @Override
        public int getStatusCode() {
            return 422;
        }

        @Override
        public Status.Family getFamily() {
            return Status.Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Unprocessable Entity";
        }
    };

    private ApiProblem() {}

    public static HttpProblem validation(List<String> errors) {
        return HttpProblem.builder()
                .withTitle("Unprocessable Entity")
                .withStatus(UNPROCESSABLE_ENTITY)
                .withDetail("Validation error")
                .with("errors", errors)
                .build();
    }

    /**
     * 401 with a bearer challenge. The detail never says why the credentials failed.
     */
    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .withHeader("WWW-Authenticate", "Bearer")
                .build();
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem notFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    /**
     * Create a 429 Too Many Requests problem with full rate limit details.
     *
     * @param detail the error detail message
     * @param retryAfterSeconds seconds until client can retry
     * @param limit the rate limit
     * @param remaining remaining requests (typically 0)
     * @param resetAt Unix timestamp when limit resets
     * @return rate limit problem
     */
    public static HttpProblem tooManyRequests(
            String detail, long retryAfterSeconds, long limit, long remaining, long resetAt) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.fromStatusCode(429))
                .withDetail(detail)
                .with("retry_after", retryAfterSeconds)
                .with("limit", limit)
                .with("remaining", remaining)
                .with("reset_at", resetAt)
                .build();
    }

    public static HttpProblem predictionFailed() {
        return internalError("Prediction failed");
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }

    /**
     * Copy a problem, adding the request's correlation id.
     */
    public static HttpProblem withCorrelationId(HttpProblem problem, String correlationId) {
        HttpProblem.Builder builder = HttpProblem.builder()
                .withType(problem.getType())
                .withTitle(problem.getTitle())
                .withStatus(problem.getStatusCode())
                .withDetail(problem.getDetail())
                .withInstance(problem.getInstance());
        problem.getParameters().forEach(builder::with);
        problem.getHeaders().forEach(builder::withHeader);
        return builder.with(CORRELATION_ID, correlationId).build();
    }
}
