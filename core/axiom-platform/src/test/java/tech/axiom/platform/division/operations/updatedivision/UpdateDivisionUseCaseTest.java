package tech.axiom.platform.division.operations.updatedivision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.common.errors.UseCaseError;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionErrors;
import tech.axiom.platform.division.DivisionTestFixture;
import tech.axiom.platform.division.events.DivisionUpdated;

import static org.assertj.core.api.Assertions.*;

class UpdateDivisionUseCaseTest {

    private DivisionTestFixture fx;
    private UpdateDivisionUseCase useCase;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        fx = new DivisionTestFixture();
        useCase = new UpdateDivisionUseCase();
        useCase.divisionRepo = fx.repo;
        useCase.integrity = fx.integrity;
        useCase.unitOfWork = fx.unitOfWork;
        context = ExecutionContext.create("tester");

        fx.add(1L, "HQ", null, 10);
        fx.add(2L, "ALPHA", 1L, 10);
        fx.add(3L, "ALPHA-1", 2L, 10);
        fx.add(4L, "BETA", null, 20);
    }

    @Test
    @DisplayName("update should change only the fields present in the command")
    void update_shouldApplyPartialChanges() {
        Division before = fx.get(2L);
        var command = new UpdateDivisionCommand(2L, null, "Alpha Renamed", "AR", null, null, true, null);

        Result<DivisionUpdated> result = useCase.execute(command, context);

        assertThat(result.isSuccess()).isTrue();
        Division after = fx.get(2L);
        assertThat(after.name).isEqualTo("Alpha Renamed");
        assertThat(after.shortName).isEqualTo("AR");
        assertThat(after.internal).isTrue();
        assertThat(after.code).isEqualTo(before.code);
        assertThat(after.parentId).isEqualTo(before.parentId);
        assertThat(after.sortOrder).isEqualTo(before.sortOrder);
        assertThat(after.active).isTrue();
    }

    @Test
    @DisplayName("update should remove the short name when asked to clear it")
    void update_shouldClearShortName() {
        Division alpha = fx.get(2L);
        alpha.shortName = "AL";
        fx.repo.put(alpha);
        var command = new UpdateDivisionCommand(2L, null, null, null, null, null, null, null, true);

        Result<DivisionUpdated> result = useCase.execute(command, context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(fx.get(2L).shortName).isNull();
        assertThat(fx.get(2L).name).isNotNull();
        assertThat(((Result.Success<DivisionUpdated>) result).value().shortName()).isNull();
    }

    @Test
    @DisplayName("update should fail with DIVISION_NOT_FOUND for a soft-deleted division")
    void update_shouldFail_whenDivisionDeleted() {
        fx.addDeleted(9L, "OLD", null, 30);

        Result<DivisionUpdated> result = useCase.execute(rename(9L), context);

        UseCaseError error = ((Result.Failure<DivisionUpdated>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(error.code()).isEqualTo(DivisionErrors.DIVISION_NOT_FOUND);
    }

    @Test
    @DisplayName("update should fail with CODE_EXISTS when taking another division's code")
    void update_shouldFail_whenCodeTaken() {
        var command = new UpdateDivisionCommand(4L, "alpha", null, null, null, null, null, null);

        Result<DivisionUpdated> result = useCase.execute(command, context);

        assertThat(((Result.Failure<DivisionUpdated>) result).error().code()).isEqualTo(DivisionErrors.CODE_EXISTS);
    }

    @Test
    @DisplayName("update should accept its own code in a different case")
    void update_shouldAcceptOwnCode() {
        var command = new UpdateDivisionCommand(4L, "beta", null, null, null, null, null, null);

        assertThat(useCase.execute(command, context).isSuccess()).isTrue();
        assertThat(fx.get(4L).code).isEqualTo("BETA");
    }

    @Test
    @DisplayName("update should fail with SELF_PARENT")
    void update_shouldFail_whenSelfParent() {
        var command = new UpdateDivisionCommand(2L, null, null, null, 2L, null, null, null);

        Result<DivisionUpdated> result = useCase.execute(command, context);

        assertThat(((Result.Failure<DivisionUpdated>) result).error().code()).isEqualTo(DivisionErrors.SELF_PARENT);
    }

    @Test
    @DisplayName("update should fail with CIRCULAR_REFERENCE when parenting under a descendant")
    void update_shouldFail_whenParentIsDescendant() {
        var command = new UpdateDivisionCommand(1L, null, null, null, 3L, null, null, null);

        Result<DivisionUpdated> result = useCase.execute(command, context);

        assertThat(((Result.Failure<DivisionUpdated>) result).error().code())
            .isEqualTo(DivisionErrors.CIRCULAR_REFERENCE);
        assertThat(fx.get(1L).parentId).isNull();
    }

    @Test
    @DisplayName("update should fail with PARENT_NOT_FOUND for an unknown parent")
    void update_shouldFail_whenParentUnknown() {
        var command = new UpdateDivisionCommand(2L, null, null, null, 99L, null, null, null);

        Result<DivisionUpdated> result = useCase.execute(command, context);

        assertThat(((Result.Failure<DivisionUpdated>) result).error().code())
            .isEqualTo(DivisionErrors.PARENT_NOT_FOUND);
    }

    @Test
    @DisplayName("update should make the division a root when parent is 0")
    void update_shouldMoveToRoot_whenParentZero() {
        var command = new UpdateDivisionCommand(3L, null, null, null, 0L, null, null, null);

        assertThat(useCase.execute(command, context).isSuccess()).isTrue();
        assertThat(fx.get(3L).parentId).isNull();
    }

    private static UpdateDivisionCommand rename(long id) {
        return new UpdateDivisionCommand(id, null, "Renamed", null, null, null, null, null);
    }
}
