package appraiser.system.filter;

import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import appraiser.adapter.in.http.CorrelationId;
import appraiser.adapter.in.problem.ApiProblem;
import appraiser.core.model.ratelimit.RateLimitCategory;
import appraiser.core.model.ratelimit.RateLimitDecision;
import appraiser.core.service.common.TrustedProxyValidator;
import appraiser.core.service.ratelimit.RateLimitService;

/**
 * Reactive filter that enforces per-client admission limits.
 *
 * <p>Requests are classified by path:
 * <ul>
 *   <li>{@code POST /auth/keys} - key issuance</li>
 *   <li>{@code POST /auth/token} - token exchange</li>
 *   <li>{@code /predict} and below - general</li>
 * </ul>
 * Other paths are not limited.
 *
 * <p>Clients are identified by the connection's remote address. When that peer is a
 * configured trusted proxy, {@code Forwarded} and then {@code X-Forwarded-For} name the
 * client instead.
 */
public class RateLimitFilter {

    private static final String RATE_LIMIT_DECISION_ATTR = "appraiser.ratelimit.decision";

    private final RateLimitService rateLimitService;
    private final TrustedProxyValidator trustedProxyValidator;

    @Inject
    public RateLimitFilter(RateLimitService rateLimitService, TrustedProxyValidator trustedProxyValidator) {
        this.rateLimitService = rateLimitService;
        this.trustedProxyValidator = trustedProxyValidator;
    }

    /**
     * Reactive filter method for rate limiting.
     *
     * @param requestContext the request context
     * @param request the underlying HTTP request
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 50)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        if (!rateLimitService.isEnabled()) {
            return Uni.createFrom().nullItem();
        }

        Optional<RateLimitCategory> category =
                categorize(requestContext.getMethod(), requestContext.getUriInfo().getPath());
        if (category.isEmpty()) {
            return Uni.createFrom().nullItem();
        }

        String clientIp = extractClientIp(requestContext, request, trustedProxyValidator);
        return rateLimitService.checkAndConsume(clientIp, category.get()).map(decision -> {
            requestContext.setProperty(RATE_LIMIT_DECISION_ATTR, decision);
            if (!decision.allowed()) {
                return buildRateLimitResponse(requestContext, decision);
            }
            return null;
        });
    }

    @ServerResponseFilter
    public void addRateLimitHeaders(ContainerRequestContext req, ContainerResponseContext res) {
        if (!rateLimitService.includeHeaders()) {
            return;
        }
        if (req.getProperty(RATE_LIMIT_DECISION_ATTR) instanceof RateLimitDecision decision && decision.allowed()) {
            res.getHeaders().putSingle("X-RateLimit-Limit", decision.limit());
            res.getHeaders().putSingle("X-RateLimit-Remaining", decision.remaining());
            res.getHeaders().putSingle("X-RateLimit-Reset", decision.resetAtEpochSeconds());
        }
    }

    static Optional<RateLimitCategory> categorize(String method, String path) {
        String normalized = path.endsWith("/") && path.length() > 1 ? path.substring(0, path.length() - 1) : path;
        if ("POST".equals(method) && "/auth/keys".equals(normalized)) {
            return Optional.of(RateLimitCategory.KEY_ISSUANCE);
        }
        if ("POST".equals(method) && "/auth/token".equals(normalized)) {
            return Optional.of(RateLimitCategory.TOKEN_EXCHANGE);
        }
        if ("/predict".equals(normalized) || normalized.startsWith("/predict/")) {
            return Optional.of(RateLimitCategory.GENERAL);
        }
        return Optional.empty();
    }

    private Response buildRateLimitResponse(ContainerRequestContext ctx, RateLimitDecision decision) {
        final var detail = "Rate limit exceeded. Retry after %d seconds.".formatted(decision.retryAfterSeconds());
        final var problem = ApiProblem.tooManyRequests(
                detail, decision.retryAfterSeconds(), decision.limit(), 0, decision.resetAtEpochSeconds());

        return Response.status(429)
                .type("application/problem+json")
                .header("Retry-After", decision.retryAfterSeconds())
                .header("X-RateLimit-Limit", decision.limit())
                .header("X-RateLimit-Remaining", 0)
                .header("X-RateLimit-Reset", decision.resetAtEpochSeconds())
                .entity(ApiProblem.withCorrelationId(problem, CorrelationId.resolve(ctx)))
                .build();
    }

    static String extractClientIp(
            ContainerRequestContext ctx, HttpServerRequest request, TrustedProxyValidator trustedProxies) {
        final var peerIp =
                request != null && request.remoteAddress() != null ? request.remoteAddress().host() : null;
        if (!trustedProxies.isTrustedProxy(peerIp)) {
            return peerIp != null ? peerIp : "unknown";
        }

        // RFC 7239 Forwarded header (preferred)
        final var forwarded = ctx.getHeaderString("Forwarded");
        if (forwarded != null) {
            final var ip = parseForwardedFor(forwarded);
            if (ip != null) {
                return ip;
            }
        }

        final var xForwardedFor = ctx.getHeaderString("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return peerIp;
    }

    /**
     * Parse the client IP from RFC 7239 Forwarded header.
     *
     * @param forwarded the Forwarded header value
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        // First entry is closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (trimmed.toLowerCase().startsWith("for=")) {
                var value = trimmed.substring(4);
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() > 1) {
                    value = value.substring(1, value.length() - 1);
                }
                // IPv6: address is inside brackets, port follows
                if (value.startsWith("[")) {
                    final var bracketEnd = value.indexOf(']');
                    if (bracketEnd > 0) {
                        return value.substring(1, bracketEnd);
                    }
                }
                // IPv4 with port has exactly one colon
                final var colonCount = value.length() - value.replace(":", "").length();
                if (colonCount == 1) {
                    value = value.substring(0, value.indexOf(':'));
                }
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }
}
