package tech.axiom.platform.audit.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.axiom.platform.audit.AuditLog;
import tech.axiom.platform.audit.AuditLogRepository;
import tech.axiom.platform.audit.entity.AuditLogEntity;
import tech.axiom.platform.audit.mapper.AuditLogMapper;
import tech.axiom.platform.shared.Instrumented;

import java.util.List;

/**
 * Panache-based implementation of AuditLogRepository.
 */
@ApplicationScoped
@Instrumented(table = "audit_logs")
public class PanacheAuditLogRepository implements AuditLogRepository, PanacheRepositoryBase<AuditLogEntity, String> {

    @Override
    public List<AuditLog> findByEntity(String entityType, String entityId, int limit) {
        return getEntityManager().createQuery(
                "FROM AuditLogEntity WHERE entityType = :entityType AND entityId = :entityId "
                    + "ORDER BY performedAt DESC, id DESC",
                AuditLogEntity.class)
            .setParameter("entityType", entityType)
            .setParameter("entityId", entityId)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(AuditLogMapper::toDomain)
            .toList();
    }

    @Override
    public List<AuditLog> findRecent(String entityType, int limit) {
        return getEntityManager().createQuery(
                "FROM AuditLogEntity WHERE entityType = :entityType ORDER BY performedAt DESC, id DESC",
                AuditLogEntity.class)
            .setParameter("entityType", entityType)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(AuditLogMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(AuditLog log) {
        persist(AuditLogMapper.toEntity(log));
    }
}
