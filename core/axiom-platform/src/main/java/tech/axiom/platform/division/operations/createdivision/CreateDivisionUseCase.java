package tech.axiom.platform.division.operations.createdivision;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.common.UnitOfWork;
import tech.axiom.platform.common.errors.UseCaseError;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionIntegrity;
import tech.axiom.platform.division.DivisionOrdering;
import tech.axiom.platform.division.events.DivisionCreated;
import tech.axiom.platform.shared.TsidGenerator;

import java.util.Optional;

/**
 * Use case for creating a division.
 */
@ApplicationScoped
public class CreateDivisionUseCase {

    private static final Logger LOG = Logger.getLogger(CreateDivisionUseCase.class);

    @Inject
    DivisionIntegrity integrity;

    @Inject
    DivisionOrdering ordering;

    @Inject
    UnitOfWork unitOfWork;

    @Transactional
    public Result<DivisionCreated> execute(CreateDivisionCommand command, ExecutionContext context) {
        Optional<UseCaseError> fieldError = integrity.checkFields(
            command.code(), command.name(), command.shortName(), false);
        if (fieldError.isPresent()) {
            return Result.failure(fieldError.get());
        }

        String code = Division.normalizeCode(command.code());
        Optional<UseCaseError> codeError = integrity.checkCodeAvailable(code, null);
        if (codeError.isPresent()) {
            return Result.failure(codeError.get());
        }

        Long parentId = Division.normalizeParentId(command.parentId());
        if (parentId != null) {
            Optional<UseCaseError> parentError = integrity.checkParentExists(parentId);
            if (parentError.isPresent()) {
                return Result.failure(parentError.get());
            }
        }

        int sortOrder = command.sortOrder() == null || command.sortOrder() == 0
            ? ordering.nextSortOrder(parentId)
            : command.sortOrder();

        Division division = new Division(TsidGenerator.generateLong(), code, command.name(), parentId, sortOrder);
        division.shortName = command.shortName();
        division.internal = Boolean.TRUE.equals(command.internal());
        division.active = command.active() == null || command.active();

        DivisionCreated event = DivisionCreated.fromContext(context)
            .divisionId(division.id)
            .code(division.code)
            .name(division.name)
            .parentId(division.parentId)
            .sortOrder(division.sortOrder)
            .build();

        Result<DivisionCreated> result = unitOfWork.commit(division, event, command);
        LOG.infof("Created division [%d] with code [%s] under parent [%s]", division.id, code, parentId);
        return result;
    }
}
