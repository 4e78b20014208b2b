package tech.axiom.platform.common;

import java.time.Instant;

/**
 * Base interface for all domain events.
 *
 * <p>Domain events represent facts about what happened in the domain (past tense)
 * and are the success value of every write operation. The unit of work records
 * each one in the audit log.
 *
 * <p>Naming convention: Events are named in past tense describing what happened.
 * <ul>
 *   <li>{@code DivisionCreated} (not CreateDivision)</li>
 *   <li>{@code DivisionMoved} (not MoveDivision)</li>
 * </ul>
 */
public interface DomainEvent {

    /**
     * Unique identifier for this event (TSID Crockford Base32 string).
     */
    String eventId();

    /**
     * Event type code following the format: {app}:{domain}:{aggregate}:{action}
     * <p>Example: "axiom:org:division:created"
     */
    String eventType();

    /**
     * Qualified aggregate identifier.
     * <p>Format: {domain}.{aggregate}.{id}
     * <p>Example: "org.division.123456789"
     */
    String subject();

    /**
     * When the event occurred.
     */
    Instant time();

    /**
     * Execution ID for tracking a single use case execution.
     */
    String executionId();

    /**
     * Correlation ID for distributed tracing.
     */
    String correlationId();

    /**
     * ID of the event that caused this event (if any).
     */
    String causationId();

    /**
     * Principal that performed the action.
     */
    String principalId();

    /**
     * Serialized event payload, stored with the audit log entry.
     */
    String toDataJson();
}
