package tech.axiom.platform.audit;

import java.time.Instant;

/**
 * Audit log entry tracking operations performed on entities.
 *
 * Stores the full operation payload as JSON for a complete audit trail.
 */
public class AuditLog {

    public String id;

    /**
     * The type of entity (e.g., "Division").
     */
    public String entityType;

    /**
     * The entity's ID in string form.
     */
    public String entityId;

    /**
     * The operation name (e.g., "CreateDivisionCommand").
     */
    public String operation;

    /**
     * The full operation record serialized as JSON.
     */
    public String operationJson;

    /**
     * The event type emitted by the operation.
     */
    public String eventType;

    public String eventId;

    /**
     * The event payload serialized as JSON, e.g. the siblings renumbered by a move.
     */
    public String eventData;

    /**
     * The principal who performed the operation.
     */
    public String principalId;

    public String correlationId;

    /**
     * When the operation was performed.
     */
    public Instant performedAt = Instant.now();

    public AuditLog() {
    }
}
