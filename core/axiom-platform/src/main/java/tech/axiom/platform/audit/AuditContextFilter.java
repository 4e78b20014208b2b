package tech.axiom.platform.audit;

import jakarta.inject.Inject;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.ext.Provider;

/**
 * JAX-RS filter that populates {@link AuditContext} from the {@code X-Principal-ID} header.
 *
 * Authentication is handled in front of this service; the header carries the
 * already-authenticated principal.
 */
@Provider
public class AuditContextFilter implements ContainerRequestFilter {

    public static final String PRINCIPAL_ID_HEADER = "X-Principal-ID";

    @Inject
    AuditContext auditContext;

    @Override
    public void filter(ContainerRequestContext ctx) {
        String principalId = ctx.getHeaderString(PRINCIPAL_ID_HEADER);
        if (principalId != null && !principalId.isBlank()) {
            auditContext.setPrincipalId(principalId.trim());
        }
    }
}
