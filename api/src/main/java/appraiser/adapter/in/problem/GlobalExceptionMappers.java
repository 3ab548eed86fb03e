package appraiser.adapter.in.problem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.ElementKind;
import jakarta.validation.Path;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.UnauthorizedException;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import appraiser.adapter.in.http.CorrelationId;
import appraiser.core.model.InvalidRequestException;
import appraiser.core.model.auth.CredentialCollisionException;
import appraiser.core.model.prediction.PredictionException;
import appraiser.spi.StorageProviderException;

/**
 * Exception mappers rendering every failure as an RFC 7807 problem carrying the
 * request's correlation id.
 *
 * <p>Mappers run ahead of the ones contributed by extensions so that validation
 * failures and security failures keep this API's status codes and body shape.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";
    private static final int PRIORITY = Priorities.USER - 100;

    static final String INVALID_CREDENTIALS = "Could not validate credentials";

    @ServerExceptionMapper(priority = PRIORITY)
    public Response mapHttpProblem(HttpProblem problem, ContainerRequestContext ctx) {
        return toResponse(problem, ctx);
    }

    @ServerExceptionMapper(priority = PRIORITY)
    public Response mapConstraintViolation(ConstraintViolationException e, ContainerRequestContext ctx) {
        List<String> errors = e.getConstraintViolations().stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(GlobalExceptionMappers::describe)
                .toList();
        LOG.debugv("Validation error: {0}", errors);
        return toResponse(ApiProblem.validation(errors), ctx);
    }

    @ServerExceptionMapper(
            value = {AuthenticationFailedException.class, UnauthorizedException.class},
            priority = PRIORITY)
    public Response mapAuthenticationFailure(RuntimeException e, ContainerRequestContext ctx) {
        LOG.debugv("Authentication failed: {0}", e.getClass().getSimpleName());
        return toResponse(ApiProblem.unauthorized(INVALID_CREDENTIALS), ctx);
    }

    @ServerExceptionMapper
    public Response mapCredentialCollision(CredentialCollisionException e, ContainerRequestContext ctx) {
        LOG.errorv("Key issuance aborted: {0}", e.getMessage());
        return toResponse(ApiProblem.internalError("Internal server error"), ctx);
    }

    @ServerExceptionMapper
    public Response mapPredictionFailure(PredictionException e, ContainerRequestContext ctx) {
        LOG.errorv(e, "Prediction failed [{0}]", CorrelationId.resolve(ctx));
        return toResponse(ApiProblem.predictionFailed(), ctx);
    }

    @ServerExceptionMapper
    public Response mapInvalidRequest(InvalidRequestException e, ContainerRequestContext ctx) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(ApiProblem.validation(List.of(e.getMessage())), ctx);
    }

    @ServerExceptionMapper
    public Response mapStorageFailure(StorageProviderException e, ContainerRequestContext ctx) {
        LOG.errorv(e, "Storage failure [{0}]", CorrelationId.resolve(ctx));
        return toResponse(ApiProblem.internalError("Internal server error"), ctx);
    }

    @ServerExceptionMapper
    public Response mapUnexpected(RuntimeException e, ContainerRequestContext ctx) {
        if (e instanceof WebApplicationException wae) {
            return wae.getResponse();
        }
        LOG.errorv(e, "Unhandled error [{0}]", CorrelationId.resolve(ctx));
        return toResponse(ApiProblem.internalError("Internal server error"), ctx);
    }

    private Response toResponse(HttpProblem problem, ContainerRequestContext ctx) {
        HttpProblem withId = ApiProblem.withCorrelationId(problem, CorrelationId.resolve(ctx));
        Response.ResponseBuilder builder = Response.status(withId.getStatusCode())
                .type(PROBLEM_JSON)
                .entity(withId);
        withId.getHeaders().forEach(builder::header);
        return builder.build();
    }

    /**
     * Render a violation as {@code field: message} using wire field names. Method and
     * parameter nodes are dropped unless the parameter itself is the violated element.
     */
    static String describe(ConstraintViolation<?> violation) {
        List<Path.Node> nodes = new ArrayList<>();
        violation.getPropertyPath().forEach(nodes::add);

        List<String> segments = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            Path.Node node = nodes.get(i);
            ElementKind kind = node.getKind();
            boolean leaf = i == nodes.size() - 1;
            if (kind == ElementKind.METHOD || (kind == ElementKind.PARAMETER && !leaf)) {
                continue;
            }
            if (node.isInIterable() && node.getIndex() != null && !segments.isEmpty()) {
                int last = segments.size() - 1;
                segments.set(last, segments.get(last) + "[" + node.getIndex() + "]");
            }
            if (kind == ElementKind.CONTAINER_ELEMENT || node.getName() == null || node.getName().isEmpty()) {
                continue;
            }
            segments.add(snakeCase(node.getName()));
        }
        String field = segments.isEmpty() ? "body" : String.join(".", segments);
        return field + ": " + violation.getMessage();
    }

    static String snakeCase(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }
}
