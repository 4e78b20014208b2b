package tech.axiom.platform.division;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.OffsetPage;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.division.events.DivisionCreated;
import tech.axiom.platform.division.events.DivisionDeleted;
import tech.axiom.platform.division.events.DivisionMoved;
import tech.axiom.platform.division.events.DivisionRestored;
import tech.axiom.platform.division.events.DivisionUpdated;
import tech.axiom.platform.division.operations.createdivision.CreateDivisionCommand;
import tech.axiom.platform.division.operations.createdivision.CreateDivisionUseCase;
import tech.axiom.platform.division.operations.deletedivision.DeleteDivisionCommand;
import tech.axiom.platform.division.operations.deletedivision.DeleteDivisionUseCase;
import tech.axiom.platform.division.operations.movedivision.MoveDivisionCommand;
import tech.axiom.platform.division.operations.movedivision.MoveDivisionUseCase;
import tech.axiom.platform.division.operations.restoredivision.RestoreDivisionCommand;
import tech.axiom.platform.division.operations.restoredivision.RestoreDivisionUseCase;
import tech.axiom.platform.division.operations.updatedivision.UpdateDivisionCommand;
import tech.axiom.platform.division.operations.updatedivision.UpdateDivisionUseCase;

import java.util.List;
import java.util.Optional;

/**
 * DivisionOperations - Single point of discovery for the Division aggregate.
 *
 * <p>All write operations on Divisions go through this service. Each operation:
 * <ul>
 *   <li>Takes a command describing what to do</li>
 *   <li>Takes an execution context for tracing and principal info</li>
 *   <li>Returns a Result containing either the domain event or an error</li>
 *   <li>Atomically commits the divisions it touches and the audit log</li>
 * </ul>
 *
 * <p>Read operations do not require execution context and do not emit events.
 */
@ApplicationScoped
public class DivisionOperations {

    // ========================================================================
    // Write Operations (Use Cases)
    // ========================================================================

    @Inject
    CreateDivisionUseCase createDivisionUseCase;

    @Inject
    UpdateDivisionUseCase updateDivisionUseCase;

    @Inject
    DeleteDivisionUseCase deleteDivisionUseCase;

    @Inject
    RestoreDivisionUseCase restoreDivisionUseCase;

    @Inject
    MoveDivisionUseCase moveDivisionUseCase;

    /**
     * Create a new Division.
     *
     * @param command The command containing division details
     * @param context The execution context
     * @return Success with DivisionCreated, or Failure with error
     */
    public Result<DivisionCreated> createDivision(CreateDivisionCommand command, ExecutionContext context) {
        return createDivisionUseCase.execute(command, context);
    }

    /**
     * Update a Division. Only the fields present in the command are changed.
     *
     * @param command The command containing update details
     * @param context The execution context
     * @return Success with DivisionUpdated, or Failure with error
     */
    public Result<DivisionUpdated> updateDivision(UpdateDivisionCommand command, ExecutionContext context) {
        return updateDivisionUseCase.execute(command, context);
    }

    /**
     * Soft- or hard-delete a Division.
     *
     * @param command The command identifying the division and the delete mode
     * @param context The execution context
     * @return Success with DivisionDeleted, or Failure with error
     */
    public Result<DivisionDeleted> deleteDivision(DeleteDivisionCommand command, ExecutionContext context) {
        return deleteDivisionUseCase.execute(command, context);
    }

    /**
     * Restore a soft-deleted Division.
     *
     * @param command The command identifying the division to restore
     * @param context The execution context
     * @return Success with DivisionRestored, or Failure with error
     */
    public Result<DivisionRestored> restoreDivision(RestoreDivisionCommand command, ExecutionContext context) {
        return restoreDivisionUseCase.execute(command, context);
    }

    /**
     * Move a Division under a new parent, or re-slot it among its siblings.
     *
     * @param command The command with the new parent and optional sort order
     * @param context The execution context
     * @return Success with DivisionMoved, or Failure with error
     */
    public Result<DivisionMoved> moveDivision(MoveDivisionCommand command, ExecutionContext context) {
        return moveDivisionUseCase.execute(command, context);
    }

    // ========================================================================
    // Read Operations (Queries)
    // ========================================================================

    @Inject
    DivisionRepository divisionRepo;

    @Inject
    DivisionHierarchy hierarchy;

    public Optional<Division> findById(long id, boolean includeDeleted) {
        return divisionRepo.findById(id, includeDeleted);
    }

    /**
     * Find a Division by code, ignoring case.
     */
    public Optional<Division> findByCode(String code, boolean includeDeleted) {
        return divisionRepo.findByCode(Division.normalizeCode(code), includeDeleted);
    }

    /**
     * One page of divisions matching the filter, ordered by {@code (sortOrder, name)}.
     */
    public OffsetPage<Division> search(DivisionFilter filter, int skip, int limit) {
        List<Division> items = divisionRepo.search(filter, skip, limit);
        long total = divisionRepo.count(filter);
        return new OffsetPage<>(items, total, skip, limit);
    }

    /**
     * All divisions matching the filter, unpaged.
     */
    public List<Division> list(DivisionFilter filter) {
        return divisionRepo.list(filter);
    }

    /**
     * Direct children of a division, or empty if the parent does not resolve.
     */
    public Optional<List<Division>> findChildren(long parentId, boolean includeDeleted) {
        if (divisionRepo.findById(parentId, includeDeleted).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(hierarchy.getChildren(parentId, includeDeleted));
    }

    /**
     * @see DivisionHierarchy#getHierarchyTree(Long)
     */
    public List<Division> getHierarchyTree(Long rootId) {
        return hierarchy.getHierarchyTree(rootId);
    }

    /**
     * @see DivisionHierarchy#getAvailableCodes(String)
     */
    public List<String> getAvailableCodes(String prefix) {
        return hierarchy.getAvailableCodes(prefix);
    }

    /**
     * Active, non-deleted divisions whose code, name or short name contains {@code query}.
     */
    public List<Division> suggest(String query, int limit) {
        return divisionRepo.search(new DivisionFilter(false, true, query), 0, limit);
    }
}
