package tech.axiom.platform.common;

import java.util.List;

/**
 * Unit of Work for atomic division operations.
 *
 * <p>Writes aggregate state changes and the matching audit log entry within the
 * caller's transaction. Use cases return success only through this interface, so
 * every committed state change has an event and an audit row.
 *
 * <p>Usage in a use case:
 * <pre>{@code
 * if (nameMissing) {
 *     return Result.failure(new ValidationError(...));
 * }
 * DivisionCreated event = DivisionCreated.fromContext(ctx).divisionId(division.id).build();
 * return unitOfWork.commit(division, event, command);
 * }</pre>
 *
 * <p>Implementations flush before returning, so store constraint violations are raised
 * while the use case is still on the stack and roll the whole transaction back.
 */
public interface UnitOfWork {

    /**
     * Insert or update an aggregate and record its event.
     *
     * @param aggregate The entity to save
     * @param event     The domain event representing what happened
     * @param command   The command that was executed (for audit log)
     * @param <T>       The domain event type
     * @return Success with the event
     */
    <T extends DomainEvent> Result<T> commit(Object aggregate, T event, Object command);

    /**
     * Permanently delete an aggregate and record its event.
     *
     * @param aggregate The entity to delete
     * @param event     The domain event representing the deletion
     * @param command   The command that was executed (for audit log)
     * @param <T>       The domain event type
     * @return Success with the event
     */
    <T extends DomainEvent> Result<T> commitDelete(Object aggregate, T event, Object command);

    /**
     * Save several aggregates with a single event, e.g. a moved division together
     * with its renumbered former siblings.
     *
     * @param aggregates The entities to save
     * @param event      The domain event representing what happened
     * @param command    The command that was executed (for audit log)
     * @param <T>        The domain event type
     * @return Success with the event
     */
    <T extends DomainEvent> Result<T> commitAll(List<?> aggregates, T event, Object command);
}
