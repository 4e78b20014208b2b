package tech.axiom.platform.division.operations.movedivision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.axiom.platform.common.ExecutionContext;
import tech.axiom.platform.common.Result;
import tech.axiom.platform.division.DivisionErrors;
import tech.axiom.platform.division.DivisionTestFixture;
import tech.axiom.platform.division.events.DivisionMoved;

import static org.assertj.core.api.Assertions.*;

class MoveDivisionUseCaseTest {

    private DivisionTestFixture fx;
    private MoveDivisionUseCase useCase;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        fx = new DivisionTestFixture();
        useCase = new MoveDivisionUseCase();
        useCase.divisionRepo = fx.repo;
        useCase.integrity = fx.integrity;
        useCase.ordering = fx.ordering;
        useCase.unitOfWork = fx.unitOfWork;
        context = ExecutionContext.create("tester");

        //  HQ(1): A(2)=10, B(3)=20, C(4)=30
        //  LAB(5): X(6)=10
        fx.add(1L, "HQ", null, 10);
        fx.add(2L, "A", 1L, 10);
        fx.add(3L, "B", 1L, 20);
        fx.add(4L, "C", 1L, 30);
        fx.add(5L, "LAB", null, 20);
        fx.add(6L, "X", 5L, 10);
    }

    @Test
    @DisplayName("move should append to the new sibling group and renumber the old one")
    void move_shouldAppendAndRenumberOldSiblings() {
        Result<DivisionMoved> result = useCase.execute(new MoveDivisionCommand(2L, 5L, null), context);

        assertThat(result.isSuccess()).isTrue();
        DivisionMoved event = ((Result.Success<DivisionMoved>) result).value();
        assertThat(event.oldParentId()).isEqualTo(1L);
        assertThat(event.newParentId()).isEqualTo(5L);
        assertThat(event.sortOrder()).isEqualTo(20);
        assertThat(event.renumberedSiblings()).containsExactly(
            new DivisionMoved.SiblingOrder(3L, 10),
            new DivisionMoved.SiblingOrder(4L, 20));

        assertThat(fx.get(2L).parentId).isEqualTo(5L);
        assertThat(fx.get(2L).sortOrder).isEqualTo(20);
        assertThat(fx.get(3L).sortOrder).isEqualTo(10);
        assertThat(fx.get(4L).sortOrder).isEqualTo(20);
        // New siblings untouched
        assertThat(fx.get(6L).sortOrder).isEqualTo(10);
    }

    @Test
    @DisplayName("move should apply an explicit sort order verbatim")
    void move_shouldUseExplicitSortOrder() {
        Result<DivisionMoved> result = useCase.execute(new MoveDivisionCommand(4L, 5L, 10), context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(fx.get(4L).sortOrder).isEqualTo(10);
        assertThat(fx.get(6L).sortOrder).isEqualTo(10);
    }

    @Test
    @DisplayName("move within the same parent should not renumber siblings")
    void move_shouldNotRenumber_whenParentUnchanged() {
        Result<DivisionMoved> result = useCase.execute(new MoveDivisionCommand(2L, 1L, null), context);

        DivisionMoved event = ((Result.Success<DivisionMoved>) result).value();
        assertThat(event.renumberedSiblings()).isEmpty();
        assertThat(fx.get(2L).sortOrder).isEqualTo(40);
        assertThat(fx.get(3L).sortOrder).isEqualTo(20);
    }

    @Test
    @DisplayName("move without a parent should make the division a root")
    void move_shouldMoveToTopLevel_whenNoParent() {
        Result<DivisionMoved> result = useCase.execute(new MoveDivisionCommand(6L, null, null), context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(fx.get(6L).parentId).isNull();
        assertThat(fx.get(6L).sortOrder).isEqualTo(30);
    }

    @Test
    @DisplayName("move should fail with CIRCULAR_REFERENCE under a descendant")
    void move_shouldFail_whenTargetIsDescendant() {
        Result<DivisionMoved> result = useCase.execute(new MoveDivisionCommand(1L, 2L, null), context);

        assertThat(((Result.Failure<DivisionMoved>) result).error().code())
            .isEqualTo(DivisionErrors.CIRCULAR_REFERENCE);
        assertThat(fx.unitOfWork.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("move should fail with SELF_PARENT and DIVISION_NOT_FOUND")
    void move_shouldFail_forSelfParentAndUnknownDivision() {
        Result<DivisionMoved> self = useCase.execute(new MoveDivisionCommand(3L, 3L, null), context);
        Result<DivisionMoved> unknown = useCase.execute(new MoveDivisionCommand(99L, 1L, null), context);

        assertThat(((Result.Failure<DivisionMoved>) self).error().code()).isEqualTo(DivisionErrors.SELF_PARENT);
        assertThat(((Result.Failure<DivisionMoved>) unknown).error().code()).isEqualTo(DivisionErrors.DIVISION_NOT_FOUND);
    }

    @Test
    @DisplayName("move should commit the moved division and renumbered siblings together")
    void move_shouldCommitEverythingInOneUnit() {
        useCase.execute(new MoveDivisionCommand(2L, 5L, null), context);

        assertThat(fx.unitOfWork.events()).hasSize(1);
        assertThat(fx.unitOfWork.saved()).extracting(d -> d.id).containsExactly(2L, 3L, 4L);
    }
}
