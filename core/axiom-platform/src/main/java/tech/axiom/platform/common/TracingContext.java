package tech.axiom.platform.common;

import jakarta.enterprise.context.RequestScoped;
import tech.axiom.platform.shared.TsidGenerator;

/**
 * Request-scoped context for distributed tracing.
 *
 * <p>Populated from HTTP headers by {@link TracingFilter}:
 * <ul>
 *   <li>{@code X-Correlation-ID} - Traces a request across services</li>
 *   <li>{@code X-Causation-ID} - References the event that caused this request</li>
 * </ul>
 */
@RequestScoped
public class TracingContext {

    private String correlationId;
    private String causationId;

    /**
     * Get the correlation ID for the current context.
     * If not set, generates a new one.
     */
    public String getCorrelationId() {
        if (correlationId == null) {
            correlationId = "trace-" + TsidGenerator.generateRaw();
        }
        return correlationId;
    }

    public void setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
    }

    /**
     * Get the causation ID for the current context.
     * May be null if this is a fresh request (not caused by an event).
     */
    public String getCausationId() {
        return causationId;
    }

    public void setCausationId(String causationId) {
        this.causationId = causationId;
    }
}
