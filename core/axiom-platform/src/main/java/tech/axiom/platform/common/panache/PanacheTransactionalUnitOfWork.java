package tech.axiom.platform.common.panache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.axiom.platform.audit.AuditConfig;
import tech.axiom.platform.audit.AuditLog;
import tech.axiom.platform.audit.AuditLogRepository;
import tech.axiom.platform.common.DomainEvent;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.common.UnitOfWork;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionRepository;
import tech.axiom.platform.shared.TsidGenerator;

import java.util.List;

/**
 * Panache/JPA implementation of {@link UnitOfWork} using JTA transactions.
 *
 * <p>This implementation ensures atomic commits of:
 * <ul>
 *   <li>Aggregate entities (create/update/delete)</li>
 *   <li>Audit log entry</li>
 * </ul>
 *
 * <p>All operations join the use case's JTA transaction. Store failures are not caught
 * here; they propagate to the JAX-RS exception mappers and the whole transaction rolls back.
 */
@ApplicationScoped
public class PanacheTransactionalUnitOfWork implements UnitOfWork {

    private static final Logger LOG = Logger.getLogger(PanacheTransactionalUnitOfWork.class);

    @Inject
    EntityManager em;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    DivisionRepository divisionRepo;

    @Inject
    AuditLogRepository auditLogRepo;

    @Inject
    AuditConfig auditConfig;

    @Override
    @Transactional
    public <T extends DomainEvent> Result<T> commit(Object aggregate, T event, Object command) {
        save(aggregate);
        em.flush();
        createAuditLog(aggregate, event, command);

        LOG.debugf("Committed aggregate with event [%s]", event.eventId());
        return Result.success(event);
    }

    @Override
    @Transactional
    public <T extends DomainEvent> Result<T> commitDelete(Object aggregate, T event, Object command) {
        delete(aggregate);
        em.flush();
        createAuditLog(aggregate, event, command);

        LOG.debugf("Committed delete with event [%s]", event.eventId());
        return Result.success(event);
    }

    @Override
    @Transactional
    public <T extends DomainEvent> Result<T> commitAll(List<?> aggregates, T event, Object command) {
        for (Object aggregate : aggregates) {
            save(aggregate);
        }
        em.flush();
        if (!aggregates.isEmpty()) {
            createAuditLog(aggregates.get(0), event, command);
        }

        LOG.debugf("Committed %d aggregates with event [%s]", aggregates.size(), event.eventId());
        return Result.success(event);
    }

    private void save(Object aggregate) {
        if (aggregate instanceof Division division) {
            divisionRepo.save(division);
        } else {
            throw new IllegalArgumentException("Unknown aggregate type: " + typeName(aggregate));
        }
    }

    private void delete(Object aggregate) {
        if (aggregate instanceof Division division) {
            divisionRepo.delete(division.id);
        } else {
            throw new IllegalArgumentException("Unknown aggregate type: " + typeName(aggregate));
        }
    }

    /**
     * Record the command and the event payload against the primary aggregate of the commit.
     */
    private void createAuditLog(Object aggregate, DomainEvent event, Object command) {
        if (!auditConfig.enabled()) {
            return;
        }

        AuditLog log = new AuditLog();
        log.id = TsidGenerator.generateRaw();
        log.entityType = aggregate.getClass().getSimpleName();
        log.entityId = entityId(aggregate);
        log.operation = command.getClass().getSimpleName();
        log.operationJson = toJson(command);
        log.eventType = event.eventType();
        log.eventId = event.eventId();
        log.eventData = event.toDataJson();
        log.principalId = event.principalId();
        log.correlationId = event.correlationId();
        log.performedAt = event.time();
        auditLogRepo.persist(log);
    }

    private String entityId(Object aggregate) {
        if (aggregate instanceof Division division) {
            return String.valueOf(division.id);
        }
        throw new IllegalArgumentException("Unknown aggregate type: " + typeName(aggregate));
    }

    private String toJson(Object command) {
        try {
            return objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize command " + command.getClass().getSimpleName(), e);
        }
    }

    private static String typeName(Object aggregate) {
        return aggregate == null ? "null" : aggregate.getClass().getName();
    }
}
