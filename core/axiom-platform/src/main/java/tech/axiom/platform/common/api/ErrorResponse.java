package tech.axiom.platform.common.api;

import tech.axiom.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Error body returned by every resource and exception mapper.
 *
 * @param code    Machine-readable error kind (e.g. "CODE_EXISTS")
 * @param message Human-readable description
 * @param details Structured context for the error
 */
public record ErrorResponse(String code, String message, Map<String, Object> details) {

    public ErrorResponse(String code, String message) {
        this(code, message, Map.of());
    }

    public static ErrorResponse from(UseCaseError error) {
        return new ErrorResponse(error.code(), error.message(), error.details());
    }
}
