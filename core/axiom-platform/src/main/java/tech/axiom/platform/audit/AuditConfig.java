package tech.axiom.platform.audit;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for audit logging.
 *
 * Example configuration:
 * <pre>
 * axiom.audit.enabled=false
 * </pre>
 */
@ConfigMapping(prefix = "axiom.audit")
public interface AuditConfig {

    /**
     * Whether committed operations write an audit_logs row.
     */
    @WithDefault("true")
    boolean enabled();
}
