package tech.axiom.platform.division.operations.restoredivision;

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
import tech.axiom.platform.division.DivisionRepository;
import tech.axiom.platform.division.events.DivisionRestored;

import java.time.Instant;
import java.util.Optional;

/**
 * Use case for restoring a soft-deleted division.
 *
 * <p>The code and parent are validated again: another division may have claimed the
 * code, or the parent chain may have changed, while this one was deleted.
 */
@ApplicationScoped
public class RestoreDivisionUseCase {

    private static final Logger LOG = Logger.getLogger(RestoreDivisionUseCase.class);

    @Inject
    DivisionRepository divisionRepo;

    @Inject
    DivisionIntegrity integrity;

    @Inject
    UnitOfWork unitOfWork;

    @Transactional
    public Result<DivisionRestored> execute(RestoreDivisionCommand command, ExecutionContext context) {
        long divisionId = command.divisionId();
        Optional<Division> found = divisionRepo.findById(divisionId, true);
        if (found.isEmpty()) {
            return Result.failure(DivisionErrors.notFound(divisionId));
        }
        Division division = found.get();

        if (!division.deleted) {
            return Result.failure(DivisionErrors.notDeleted(divisionId));
        }

        Optional<UseCaseError> codeError = integrity.checkCodeAvailable(division.code, divisionId);
        if (codeError.isPresent()) {
            return Result.failure(codeError.get());
        }

        Optional<UseCaseError> parentError = integrity.checkParentAssignment(divisionId, division.parentId);
        if (parentError.isPresent()) {
            return Result.failure(parentError.get());
        }

        division.deleted = false;
        division.updatedAt = Instant.now();

        DivisionRestored event = DivisionRestored.fromContext(context)
            .divisionId(division.id)
            .code(division.code)
            .build();

        Result<DivisionRestored> result = unitOfWork.commit(division, event, command);
        LOG.infof("Restored division [%d] with code [%s]", divisionId, division.code);
        return result;
    }
}
