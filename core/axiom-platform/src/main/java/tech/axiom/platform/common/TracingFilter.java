package tech.axiom.platform.common;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

/**
 * Binds the caller's tracing headers to the request so division writes carry them
 * into events and audit log entries.
 *
 * <p>{@code X-Correlation-ID} wins over {@code X-Request-ID}; without either a
 * correlation ID is generated. {@code X-Causation-ID} is optional. Values longer than
 * {@link #MAX_ID_LENGTH} do not fit the audit log and are ignored.
 *
 * <p>The correlation ID is exposed to log lines as {@code %X{correlationId}} for the
 * duration of the request and echoed on every response.
 */
@Provider
public class TracingFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(TracingFilter.class);

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CAUSATION_ID_HEADER = "X-Causation-ID";

    public static final String MDC_CORRELATION_ID = "correlationId";

    static final int MAX_ID_LENGTH = 100;

    @Inject
    TracingContext tracingContext;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String correlationId = header(requestContext, CORRELATION_ID_HEADER);
        if (correlationId == null) {
            correlationId = header(requestContext, REQUEST_ID_HEADER);
        }
        if (correlationId != null) {
            tracingContext.setCorrelationId(correlationId);
        }

        String causationId = header(requestContext, CAUSATION_ID_HEADER);
        if (causationId != null) {
            tracingContext.setCausationId(causationId);
        }

        MDC.put(MDC_CORRELATION_ID, tracingContext.getCorrelationId());
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        try {
            responseContext.getHeaders().putSingle(CORRELATION_ID_HEADER, tracingContext.getCorrelationId());
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private static String header(ContainerRequestContext requestContext, String name) {
        String value = requestContext.getHeaderString(name);
        if (value == null || value.isBlank()) {
            return null;
        }
        value = value.trim();
        if (value.length() > MAX_ID_LENGTH) {
            LOG.debugf("Ignoring %s header of %d characters", name, value.length());
            return null;
        }
        return value;
    }
}
