package tech.axiom.platform.common.api;

import jakarta.persistence.PersistenceException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * JAX-RS exception mapper for storage-layer failures.
 *
 * <p>These are infrastructure failures, kept apart from business errors:
 * <ul>
 *   <li>A store constraint violation (e.g. two concurrent creates passing the code
 *       check before either commits) returns 409 so the caller can retry.</li>
 *   <li>Anything else returns 500.</li>
 * </ul>
 * The transaction has already been rolled back when this runs.
 */
@Provider
public class PersistenceExceptionMapper implements ExceptionMapper<PersistenceException> {

    private static final Logger LOG = Logger.getLogger(PersistenceExceptionMapper.class);

    @Override
    public Response toResponse(PersistenceException exception) {
        ConstraintViolationException violation = findConstraintViolation(exception);
        if (violation != null) {
            LOG.warnf("Store constraint [%s] rejected the write", violation.getConstraintName());
            return Response.status(Response.Status.CONFLICT)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(
                    "STORE_CONSTRAINT_VIOLATION",
                    "The write conflicted with a concurrent change; retry the request",
                    violation.getConstraintName() != null
                        ? Map.of("constraint", violation.getConstraintName())
                        : Map.of()))
                .build();
        }

        LOG.errorf(exception, "Store failure");
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse("STORE_FAILURE", "The division store could not complete the request"))
            .build();
    }

    private static ConstraintViolationException findConstraintViolation(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof ConstraintViolationException cve) {
                return cve;
            }
            current = current.getCause();
        }
        return null;
    }
}
