package tech.axiom.platform.division.events;

import tech.axiom.platform.common.DomainEvent;

/**
 * Sealed hierarchy for all Division domain events.
 */
public sealed interface DivisionEvent extends DomainEvent
    permits DivisionCreated, DivisionUpdated, DivisionDeleted, DivisionRestored, DivisionMoved {

    /**
     * ID of the division the event is about.
     */
    Long divisionId();
}
