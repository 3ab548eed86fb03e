package appraiser.adapter.in.http;

import java.util.UUID;

import jakarta.ws.rs.container.ContainerRequestContext;

/**
 * Per-request correlation identifier shared by filters, exception mappers and the log MDC.
 */
public final class CorrelationId {

    public static final String HEADER = "X-Correlation-ID";
    public static final String MDC_KEY = "correlation_id";
    public static final String PROPERTY = "appraiser.correlation.id";

    private static final int LENGTH = 8;

    private CorrelationId() {}

    /**
     * Generate a fresh id: the first {@value #LENGTH} hex characters of a random UUID.
     */
    public static String generate() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, LENGTH);
    }

    /**
     * Return the id bound to this request, binding a fresh one if none exists yet.
     *
     * @param ctx the request context
     * @return the correlation id
     */
    public static String resolve(ContainerRequestContext ctx) {
        Object existing = ctx.getProperty(PROPERTY);
        if (existing instanceof String id) {
            return id;
        }
        String id = generate();
        ctx.setProperty(PROPERTY, id);
        return id;
    }
}
