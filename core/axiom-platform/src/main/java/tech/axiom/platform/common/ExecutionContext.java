package tech.axiom.platform.common;

import tech.axiom.platform.shared.TsidGenerator;

import java.time.Instant;

/**
 * Context for a use case execution.
 *
 * <p>Carries tracing IDs and principal information through the execution
 * of a use case. This context is used to populate domain event metadata.
 *
 * @param executionId   Unique ID for this execution (generated)
 * @param correlationId ID for distributed tracing (usually from original request)
 * @param causationId   ID of the parent event that caused this execution (if any)
 * @param principalId   ID of the principal performing the action
 * @param initiatedAt   When the execution was initiated
 */
public record ExecutionContext(
    String executionId,
    String correlationId,
    String causationId,
    String principalId,
    Instant initiatedAt
) {

    /**
     * Create a new execution context for a fresh request.
     *
     * <p>The executionId and correlationId are both set to a new TSID.
     * Use this for requests with no tracing context (tests, startup tasks).
     *
     * @param principalId The principal performing the action
     * @return A new execution context
     */
    public static ExecutionContext create(String principalId) {
        String execId = "exec-" + TsidGenerator.generateRaw();
        return new ExecutionContext(
            execId,
            execId,  // correlation starts as execution ID
            null,
            principalId,
            Instant.now()
        );
    }

    /**
     * Create an execution context from a TracingContext.
     *
     * <p>This is the preferred method when running within an HTTP request
     * where TracingContext has been populated from headers by {@link TracingFilter}.
     *
     * @param tracingContext The tracing context
     * @param principalId    The principal performing the action
     * @return A new execution context with correlation/causation from tracing context
     */
    public static ExecutionContext from(TracingContext tracingContext, String principalId) {
        return new ExecutionContext(
            "exec-" + TsidGenerator.generateRaw(),
            tracingContext.getCorrelationId(),
            tracingContext.getCausationId(),
            principalId,
            Instant.now()
        );
    }
}
