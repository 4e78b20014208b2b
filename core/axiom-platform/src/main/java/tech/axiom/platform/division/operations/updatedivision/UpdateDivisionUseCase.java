package tech.axiom.platform.division.operations.updatedivision;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.common.UnitOfWork;
import tech.axiom.platform.common.errors.UseCaseError;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionErrors;
import tech.axiom.platform.division.DivisionIntegrity;
import tech.axiom.platform.division.DivisionRepository;
import tech.axiom.platform.division.events.DivisionUpdated;

import java.time.Instant;
import java.util.Optional;

/**
 * Use case for partially updating a division.
 *
 * <p>Changing the parent here does not touch sort orders; use the move operation to
 * re-slot a division and close the gap it leaves.
 */
@ApplicationScoped
public class UpdateDivisionUseCase {

    @Inject
    DivisionRepository divisionRepo;

    @Inject
    DivisionIntegrity integrity;

    @Inject
    UnitOfWork unitOfWork;

    @Transactional
    public Result<DivisionUpdated> execute(UpdateDivisionCommand command, ExecutionContext context) {
        long divisionId = command.divisionId();
        Optional<Division> found = divisionRepo.findById(divisionId, false);
        if (found.isEmpty()) {
            return Result.failure(DivisionErrors.notFound(divisionId));
        }
        Division division = found.get();

        Optional<UseCaseError> fieldError = integrity.checkFields(
            command.code(), command.name(), command.shortName(), true);
        if (fieldError.isPresent()) {
            return Result.failure(fieldError.get());
        }

        String code = Division.normalizeCode(command.code());
        if (code != null && !code.equals(division.code)) {
            Optional<UseCaseError> codeError = integrity.checkCodeAvailable(code, divisionId);
            if (codeError.isPresent()) {
                return Result.failure(codeError.get());
            }
        }

        Long parentId = null;
        if (command.parentId() != null) {
            if (command.parentId() == divisionId) {
                return Result.failure(DivisionErrors.selfParent(divisionId));
            }
            parentId = Division.normalizeParentId(command.parentId());
            Optional<UseCaseError> parentError = integrity.checkParentAssignment(divisionId, parentId);
            if (parentError.isPresent()) {
                return Result.failure(parentError.get());
            }
        }

        // Apply only what was sent
        if (code != null) {
            division.code = code;
        }
        if (command.name() != null) {
            division.name = command.name();
        }
        if (command.clearShortName()) {
            division.shortName = null;
        } else if (command.shortName() != null) {
            division.shortName = command.shortName();
        }
        if (command.parentId() != null) {
            division.parentId = parentId;
        }
        if (command.sortOrder() != null) {
            division.sortOrder = command.sortOrder();
        }
        if (command.internal() != null) {
            division.internal = command.internal();
        }
        if (command.active() != null) {
            division.active = command.active();
        }
        division.updatedAt = Instant.now();

        DivisionUpdated event = DivisionUpdated.fromContext(context)
            .divisionId(division.id)
            .code(division.code)
            .name(division.name)
            .shortName(division.shortName)
            .parentId(division.parentId)
            .sortOrder(division.sortOrder)
            .internal(division.internal)
            .active(division.active)
            .build();

        return unitOfWork.commit(division, event, command);
    }
}
