package tech.axiom.platform.audit;

import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.time.Instant;
import java.util.List;

/**
 * Read-only REST resource over the audit trail written by the unit of work.
 */
@Path("/api/v1/audit-logs")
@Produces(MediaType.APPLICATION_JSON)
@Tag(name = "Audit Logs", description = "Audit trail of division mutations")
public class AuditLogResource {

    @Inject
    AuditLogRepository auditLogRepo;

    @GET
    @Operation(operationId = "listAuditLogs", summary = "List audit entries, newest first",
        description = "Filters by entity type and, optionally, a single entity ID")
    public List<AuditLogResponse> list(
            @QueryParam("entityType") @DefaultValue("Division") String entityType,
            @QueryParam("entityId") String entityId,
            @QueryParam("limit") @DefaultValue("50") @Min(1) @Max(500) int limit) {
        List<AuditLog> logs = entityId == null || entityId.isBlank()
            ? auditLogRepo.findRecent(entityType, limit)
            : auditLogRepo.findByEntity(entityType, entityId, limit);
        return logs.stream().map(AuditLogResponse::from).toList();
    }

    public record AuditLogResponse(
        String id,
        String entityType,
        String entityId,
        String operation,
        String operationJson,
        String eventType,
        String eventId,
        String eventData,
        String principalId,
        String correlationId,
        Instant performedAt
    ) {
        public static AuditLogResponse from(AuditLog log) {
            return new AuditLogResponse(
                log.id,
                log.entityType,
                log.entityId,
                log.operation,
                log.operationJson,
                log.eventType,
                log.eventId,
                log.eventData,
                log.principalId,
                log.correlationId,
                log.performedAt
            );
        }
    }
}
