package tech.axiom.platform.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for use case failures.
 *
 * Errors are categorized by type to enable consistent HTTP status mapping
 * and client-side handling. The {@link #code()} is the machine-readable kind.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (missing required fields, values too long, etc.)
     * Maps to HTTP 400 Bad Request.
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Business rule violation (duplicate code, cycle, children present, etc.)
     * Maps to HTTP 400 Bad Request.
     */
    record BusinessRuleViolation(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Entity not found.
     * Maps to HTTP 404 Not Found.
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
