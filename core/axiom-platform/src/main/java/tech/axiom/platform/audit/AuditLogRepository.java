package tech.axiom.platform.audit;

import java.util.List;

/**
 * Repository interface for AuditLog entities.
 */
public interface AuditLogRepository {

    // Read operations
    List<AuditLog> findByEntity(String entityType, String entityId, int limit);
    List<AuditLog> findRecent(String entityType, int limit);

    // Write operations
    void persist(AuditLog log);
}
