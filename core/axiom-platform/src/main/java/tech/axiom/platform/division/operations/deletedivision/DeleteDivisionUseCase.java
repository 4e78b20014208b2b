package tech.axiom.platform.division.operations.deletedivision;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.common.UnitOfWork;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionErrors;
import tech.axiom.platform.division.DivisionRepository;
import tech.axiom.platform.division.events.DivisionDeleted;

import java.time.Instant;
import java.util.Optional;

/**
 * Use case for deleting a division.
 *
 * <p>Deletion never cascades: a division with non-deleted children is rejected.
 */
@ApplicationScoped
public class DeleteDivisionUseCase {

    private static final Logger LOG = Logger.getLogger(DeleteDivisionUseCase.class);

    @Inject
    DivisionRepository divisionRepo;

    @Inject
    UnitOfWork unitOfWork;

    @Transactional
    public Result<DivisionDeleted> execute(DeleteDivisionCommand command, ExecutionContext context) {
        long divisionId = command.divisionId();
        Optional<Division> found = divisionRepo.findById(divisionId, false);
        if (found.isEmpty()) {
            return Result.failure(DivisionErrors.notFound(divisionId));
        }
        Division division = found.get();

        long childrenCount = divisionRepo.countChildren(divisionId);
        if (childrenCount > 0) {
            return Result.failure(DivisionErrors.hasChildren(divisionId, childrenCount));
        }

        DivisionDeleted event = DivisionDeleted.fromContext(context)
            .divisionId(division.id)
            .code(division.code)
            .softDelete(command.softDelete())
            .build();

        Result<DivisionDeleted> result;
        if (command.softDelete()) {
            division.deleted = true;
            division.updatedAt = Instant.now();
            result = unitOfWork.commit(division, event, command);
        } else {
            result = unitOfWork.commitDelete(division, event, command);
        }

        LOG.infof("Deleted division [%d] (%s)", divisionId, command.softDelete() ? "soft" : "hard");
        return result;
    }
}
