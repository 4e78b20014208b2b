package tech.axiom.platform.audit.mapper;

import tech.axiom.platform.audit.AuditLog;
import tech.axiom.platform.audit.entity.AuditLogEntity;

/**
 * Mapper for converting between AuditLog domain model and JPA entity.
 */
public final class AuditLogMapper {

    private AuditLogMapper() {
    }

    public static AuditLog toDomain(AuditLogEntity entity) {
        if (entity == null) {
            return null;
        }

        AuditLog domain = new AuditLog();
        domain.id = entity.id;
        domain.entityType = entity.entityType;
        domain.entityId = entity.entityId;
        domain.operation = entity.operation;
        domain.operationJson = entity.operationJson;
        domain.eventType = entity.eventType;
        domain.eventId = entity.eventId;
        domain.eventData = entity.eventData;
        domain.principalId = entity.principalId;
        domain.correlationId = entity.correlationId;
        domain.performedAt = entity.performedAt;
        return domain;
    }

    public static AuditLogEntity toEntity(AuditLog domain) {
        if (domain == null) {
            return null;
        }

        AuditLogEntity entity = new AuditLogEntity();
        entity.id = domain.id;
        entity.entityType = domain.entityType;
        entity.entityId = domain.entityId;
        entity.operation = domain.operation;
        entity.operationJson = domain.operationJson;
        entity.eventType = domain.eventType;
        entity.eventId = domain.eventId;
        entity.eventData = domain.eventData;
        entity.principalId = domain.principalId;
        entity.correlationId = domain.correlationId;
        entity.performedAt = domain.performedAt;
        return entity;
    }
}
