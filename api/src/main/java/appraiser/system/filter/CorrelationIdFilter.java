package appraiser.system.filter;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;

import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import appraiser.adapter.in.http.CorrelationId;

/**
 * Binds a correlation id to every request and reports it, with the elapsed time, on
 * every response including error responses.
 *
 * <p>Runs pre-matching so the id exists before routing, authentication and rate limiting.
 */
public class CorrelationIdFilter {

    private static final Logger LOG = Logger.getLogger(CorrelationIdFilter.class);

    static final String RESPONSE_TIME_HEADER = "X-Response-Time";
    private static final String START_NANOS = "appraiser.correlation.start";

    @ServerRequestFilter(preMatching = true)
    public void onRequest(ContainerRequestContext ctx) {
        String correlationId = CorrelationId.resolve(ctx);
        ctx.setProperty(START_NANOS, System.nanoTime());
        MDC.put(CorrelationId.MDC_KEY, correlationId);
        LOG.infof("Request started: %s %s", ctx.getMethod(), ctx.getUriInfo().getPath());
    }

    @ServerResponseFilter
    public void onResponse(ContainerRequestContext request, ContainerResponseContext response) {
        String correlationId = CorrelationId.resolve(request);
        long elapsedMs = elapsedMillis(request);

        response.getHeaders().putSingle(CorrelationId.HEADER, correlationId);
        response.getHeaders().putSingle(RESPONSE_TIME_HEADER, elapsedMs + "ms");

        MDC.put(CorrelationId.MDC_KEY, correlationId);
        LOG.infof(
                "Request completed: %s %s status=%d duration=%dms",
                request.getMethod(), request.getUriInfo().getPath(), response.getStatus(), elapsedMs);
        MDC.remove(CorrelationId.MDC_KEY);
    }

    private static long elapsedMillis(ContainerRequestContext request) {
        Object start = request.getProperty(START_NANOS);
        if (start instanceof Long startNanos) {
            return (System.nanoTime() - startNanos) / 1_000_000;
        }
        return 0;
    }
}
