package tech.axiom.platform.audit;

import jakarta.enterprise.context.RequestScoped;

/**
 * Request-scoped context holding the current principal for audit logging.
 *
 * Populated by {@link AuditContextFilter} from the {@code X-Principal-ID} header.
 * Requests without the header are recorded as {@link #ANONYMOUS_PRINCIPAL}.
 */
@RequestScoped
public class AuditContext {

    public static final String ANONYMOUS_PRINCIPAL = "anonymous";

    private String principalId;

    public void setPrincipalId(String principalId) {
        this.principalId = principalId;
    }

    /**
     * Get the current principal ID, falling back to the anonymous principal.
     */
    public String principalId() {
        return principalId != null ? principalId : ANONYMOUS_PRINCIPAL;
    }
}
