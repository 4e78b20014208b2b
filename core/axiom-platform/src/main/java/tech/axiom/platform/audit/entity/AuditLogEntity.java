package tech.axiom.platform.audit.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for audit_logs table.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_logs_entity", columnList = "entity_type, entity_id")
})
public class AuditLogEntity {

    @Id
    @Column(name = "id", length = 13)
    public String id;

    @Column(name = "entity_type", nullable = false, length = 100)
    public String entityType;

    @Column(name = "entity_id", length = 50)
    public String entityId;

    @Column(name = "operation", nullable = false, length = 100)
    public String operation;

    @Column(name = "operation_json", length = 4000)
    public String operationJson;

    @Column(name = "event_type", length = 100)
    public String eventType;

    @Column(name = "event_id", length = 13)
    public String eventId;

    @Column(name = "event_data", length = 16000)
    public String eventData;

    @Column(name = "principal_id", length = 100)
    public String principalId;

    @Column(name = "correlation_id", length = 100)
    public String correlationId;

    @Column(name = "performed_at", nullable = false)
    public Instant performedAt;

    public AuditLogEntity() {
    }
}
