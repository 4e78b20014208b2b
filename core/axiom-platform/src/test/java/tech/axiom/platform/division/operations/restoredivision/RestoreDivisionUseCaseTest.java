package tech.axiom.platform.division.operations.restoredivision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionErrors;
import tech.axiom.platform.division.DivisionTestFixture;
import tech.axiom.platform.division.events.DivisionRestored;
import tech.axiom.platform.division.operations.deletedivision.DeleteDivisionCommand;
import tech.axiom.platform.division.operations.deletedivision.DeleteDivisionUseCase;

import java.lang.reflect.Field;

import static org.assertj.core.api.Assertions.*;

class RestoreDivisionUseCaseTest {

    private DivisionTestFixture fx;
    private RestoreDivisionUseCase useCase;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        fx = new DivisionTestFixture();
        useCase = new RestoreDivisionUseCase();
        useCase.divisionRepo = fx.repo;
        useCase.integrity = fx.integrity;
        useCase.unitOfWork = fx.unitOfWork;
        context = ExecutionContext.create("tester");

        fx.add(1L, "HQ", null, 10);
    }

    @Test
    @DisplayName("soft delete then restore should round-trip the deleted flag and leave other fields alone")
    void restore_shouldRoundTrip_afterSoftDelete() throws Exception {
        Division original = fx.add(2L, "ALPHA", "Alpha", 1L, 30);
        original.shortName = "A";
        fx.repo.put(original);

        DeleteDivisionUseCase delete = new DeleteDivisionUseCase();
        inject(delete, "divisionRepo", fx.repo);
        inject(delete, "unitOfWork", fx.unitOfWork);
        assertThat(delete.execute(new DeleteDivisionCommand(2L, true), context).isSuccess()).isTrue();
        assertThat(fx.get(2L).deleted).isTrue();

        Result<DivisionRestored> result = useCase.execute(new RestoreDivisionCommand(2L), context);

        assertThat(result.isSuccess()).isTrue();
        Division restored = fx.get(2L);
        assertThat(restored.deleted).isFalse();
        assertThat(restored.code).isEqualTo("ALPHA");
        assertThat(restored.name).isEqualTo("Alpha");
        assertThat(restored.shortName).isEqualTo("A");
        assertThat(restored.parentId).isEqualTo(1L);
        assertThat(restored.sortOrder).isEqualTo(30);
    }

    @Test
    @DisplayName("restore should fail with DIVISION_NOT_DELETED for a live division")
    void restore_shouldFail_whenNotDeleted() {
        Result<DivisionRestored> result = useCase.execute(new RestoreDivisionCommand(1L), context);

        assertThat(((Result.Failure<DivisionRestored>) result).error().code())
            .isEqualTo(DivisionErrors.DIVISION_NOT_DELETED);
    }

    @Test
    @DisplayName("restore should fail with DIVISION_NOT_FOUND when no row exists")
    void restore_shouldFail_whenUnknown() {
        Result<DivisionRestored> result = useCase.execute(new RestoreDivisionCommand(404L), context);

        assertThat(((Result.Failure<DivisionRestored>) result).error().code())
            .isEqualTo(DivisionErrors.DIVISION_NOT_FOUND);
    }

    @Test
    @DisplayName("restore should fail with CODE_EXISTS when the code was reused while deleted")
    void restore_shouldFail_whenCodeReused() {
        fx.addDeleted(2L, "ALPHA", null, 20);
        fx.add(3L, "ALPHA", null, 30);

        Result<DivisionRestored> result = useCase.execute(new RestoreDivisionCommand(2L), context);

        assertThat(((Result.Failure<DivisionRestored>) result).error().code()).isEqualTo(DivisionErrors.CODE_EXISTS);
        assertThat(fx.get(2L).deleted).isTrue();
    }

    @Test
    @DisplayName("restore should accept a parent that is itself soft-deleted")
    void restore_shouldSucceed_whenParentSoftDeleted() {
        fx.addDeleted(5L, "OLD-HQ", null, 20);
        fx.addDeleted(6L, "OLD-TEAM", 5L, 10);

        Result<DivisionRestored> result = useCase.execute(new RestoreDivisionCommand(6L), context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(fx.get(6L).deleted).isFalse();
        assertThat(fx.get(6L).parentId).isEqualTo(5L);
    }

    @Test
    @DisplayName("restore should fail with PARENT_NOT_FOUND when the parent was hard-deleted")
    void restore_shouldFail_whenParentGone() {
        fx.addDeleted(2L, "ALPHA", 50L, 20);

        Result<DivisionRestored> result = useCase.execute(new RestoreDivisionCommand(2L), context);

        assertThat(((Result.Failure<DivisionRestored>) result).error().code())
            .isEqualTo(DivisionErrors.PARENT_NOT_FOUND);
    }

    private static void inject(Object target, String field, Object value) throws Exception {
        Field f = target.getClass().getDeclaredField(field);
        f.setAccessible(true);
        f.set(target, value);
    }
}
