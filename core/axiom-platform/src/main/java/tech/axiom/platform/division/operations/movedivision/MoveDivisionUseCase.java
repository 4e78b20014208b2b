package tech.axiom.platform.division.operations.movedivision;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.common.UnitOfWork;
import tech.axiom.platform.common.errors.UseCaseError;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionErrors;
import tech.axiom.platform.division.DivisionIntegrity;
import tech.axiom.platform.division.DivisionOrdering;
import tech.axiom.platform.division.DivisionRepository;
import tech.axiom.platform.division.events.DivisionMoved;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Use case for moving a division under a new parent.
 *
 * <p>When the parent changes, the former siblings are renumbered in the same
 * transaction. The new sibling group is never renumbered; an explicit
 * {@code newSortOrder} may collide with an existing sibling.
 */
@ApplicationScoped
public class MoveDivisionUseCase {

    private static final Logger LOG = Logger.getLogger(MoveDivisionUseCase.class);

    @Inject
    DivisionRepository divisionRepo;

    @Inject
    DivisionIntegrity integrity;

    @Inject
    DivisionOrdering ordering;

    @Inject
    UnitOfWork unitOfWork;

    @Transactional
    public Result<DivisionMoved> execute(MoveDivisionCommand command, ExecutionContext context) {
        long divisionId = command.divisionId();
        Optional<Division> found = divisionRepo.findById(divisionId, false);
        if (found.isEmpty()) {
            return Result.failure(DivisionErrors.notFound(divisionId));
        }
        Division division = found.get();

        Long newParentId = Division.normalizeParentId(command.newParentId());
        Optional<UseCaseError> parentError = integrity.checkParentAssignment(divisionId, newParentId);
        if (parentError.isPresent()) {
            return Result.failure(parentError.get());
        }

        Long oldParentId = division.parentId;
        boolean parentChanged = !Objects.equals(oldParentId, newParentId);

        int sortOrder = command.newSortOrder() != null
            ? command.newSortOrder()
            : ordering.nextSortOrder(newParentId, divisionId);

        List<Division> changed = new ArrayList<>();
        division.parentId = newParentId;
        division.sortOrder = sortOrder;
        division.updatedAt = Instant.now();
        changed.add(division);

        List<Division> renumbered = parentChanged
            ? ordering.renumberSiblings(oldParentId, divisionId)
            : List.of();
        changed.addAll(renumbered);

        DivisionMoved event = DivisionMoved.fromContext(context)
            .divisionId(division.id)
            .oldParentId(oldParentId)
            .newParentId(newParentId)
            .sortOrder(sortOrder)
            .renumberedSiblings(renumbered.stream()
                .map(sibling -> new DivisionMoved.SiblingOrder(sibling.id, sibling.sortOrder))
                .toList())
            .build();

        Result<DivisionMoved> result = unitOfWork.commitAll(changed, event, command);
        LOG.infof("Moved division [%d] from parent [%s] to [%s] at sort order %d",
            divisionId, oldParentId, newParentId, sortOrder);
        return result;
    }
}
