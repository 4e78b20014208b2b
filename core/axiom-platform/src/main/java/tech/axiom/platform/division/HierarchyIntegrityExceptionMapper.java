package tech.axiom.platform.division;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.axiom.platform.common.api.ErrorResponse;

import java.util.Map;

/**
 * JAX-RS exception mapper for {@link HierarchyIntegrityException}.
 *
 * Returns 500 with the division at which the walk gave up.
 */
@Provider
public class HierarchyIntegrityExceptionMapper implements ExceptionMapper<HierarchyIntegrityException> {

    private static final Logger LOG = Logger.getLogger(HierarchyIntegrityExceptionMapper.class);

    @Override
    public Response toResponse(HierarchyIntegrityException exception) {
        LOG.errorf("Division hierarchy is corrupted near division [%d]: %s",
            exception.getDivisionId(), exception.getMessage());

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(
                "HIERARCHY_CORRUPTED",
                exception.getMessage(),
                Map.of("divisionId", exception.getDivisionId())))
            .build();
    }
}
