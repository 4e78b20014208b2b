package tech.axiom.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import tech.axiom.platform.common.errors.UseCaseError;

/**
 * Translates {@link UseCaseError} values into HTTP responses.
 *
 * <p>Each error variant maps to exactly one status:
 * <ul>
 *   <li>{@link UseCaseError.NotFoundError} - 404</li>
 *   <li>{@link UseCaseError.ValidationError} - 400</li>
 *   <li>{@link UseCaseError.BusinessRuleViolation} - 400</li>
 * </ul>
 */
public final class UseCaseErrors {

    private UseCaseErrors() {
    }

    public static Response.Status statusOf(UseCaseError error) {
        if (error instanceof UseCaseError.NotFoundError) {
            return Response.Status.NOT_FOUND;
        }
        return Response.Status.BAD_REQUEST;
    }

    public static Response toResponse(UseCaseError error) {
        return Response.status(statusOf(error))
            .type(MediaType.APPLICATION_JSON)
            .entity(ErrorResponse.from(error))
            .build();
    }
}
