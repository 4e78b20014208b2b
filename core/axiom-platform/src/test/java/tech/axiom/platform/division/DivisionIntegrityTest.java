package tech.axiom.platform.division;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.axiom.platform.common.errors.UseCaseError;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DivisionIntegrity against an in-memory repository.
 */
class DivisionIntegrityTest {

    private DivisionTestFixture fx;
    private DivisionIntegrity integrity;

    @BeforeEach
    void setUp() {
        fx = new DivisionTestFixture();
        integrity = fx.integrity;

        // HQ -> ALPHA -> ALPHA-1
        fx.add(1L, "HQ", null, 10);
        fx.add(2L, "ALPHA", 1L, 10);
        fx.add(3L, "ALPHA-1", 2L, 10);
        fx.add(4L, "BETA", 1L, 20);
    }

    // ========================================
    // CODE UNIQUENESS
    // ========================================

    @Test
    @DisplayName("checkCodeAvailable should reject a code held by a non-deleted division regardless of case")
    void checkCodeAvailable_shouldReject_whenCodeTakenInAnyCase() {
        Optional<UseCaseError> error = integrity.checkCodeAvailable("hq", null);

        assertThat(error).isPresent();
        assertThat(error.get()).isInstanceOf(UseCaseError.BusinessRuleViolation.class);
        assertThat(error.get().code()).isEqualTo(DivisionErrors.CODE_EXISTS);
    }

    @Test
    @DisplayName("checkCodeAvailable should allow a division to keep its own code")
    void checkCodeAvailable_shouldAllow_whenCodeHeldByExcludedDivision() {
        assertThat(integrity.checkCodeAvailable("HQ", 1L)).isEmpty();
    }

    @Test
    @DisplayName("checkCodeAvailable should ignore soft-deleted holders of the code")
    void checkCodeAvailable_shouldAllow_whenOnlyDeletedDivisionHoldsCode() {
        fx.addDeleted(9L, "GONE", null, 30);

        assertThat(integrity.checkCodeAvailable("GONE", null)).isEmpty();
    }

    // ========================================
    // PARENT EXISTENCE
    // ========================================

    @Test
    @DisplayName("checkParentExists should fail with PARENT_NOT_FOUND for an unknown id")
    void checkParentExists_shouldFail_whenParentUnknown() {
        Optional<UseCaseError> error = integrity.checkParentExists(99L);

        assertThat(error).map(UseCaseError::code).contains(DivisionErrors.PARENT_NOT_FOUND);
        assertThat(error.get().details()).containsEntry("parentId", 99L);
    }

    @Test
    @DisplayName("checkParentExists should accept a soft-deleted parent")
    void checkParentExists_shouldAccept_whenParentSoftDeleted() {
        fx.addDeleted(9L, "GONE", null, 30);

        assertThat(integrity.checkParentExists(9L)).isEmpty();
    }

    // ========================================
    // PARENT ASSIGNMENT
    // ========================================

    @Test
    @DisplayName("checkParentAssignment should reject a division as its own parent")
    void checkParentAssignment_shouldReject_whenSelfParent() {
        assertThat(integrity.checkParentAssignment(2L, 2L))
            .map(UseCaseError::code)
            .contains(DivisionErrors.SELF_PARENT);
    }

    @Test
    @DisplayName("checkParentAssignment should reject a descendant as the new parent")
    void checkParentAssignment_shouldReject_whenParentIsDescendant() {
        Optional<UseCaseError> error = integrity.checkParentAssignment(1L, 3L);

        assertThat(error).map(UseCaseError::code).contains(DivisionErrors.CIRCULAR_REFERENCE);
        assertThat(error.get().details())
            .containsEntry("divisionId", 1L)
            .containsEntry("parentId", 3L);
    }

    @Test
    @DisplayName("checkParentAssignment should report a missing parent before checking for cycles")
    void checkParentAssignment_shouldReportMissingParent() {
        assertThat(integrity.checkParentAssignment(1L, 42L))
            .map(UseCaseError::code)
            .contains(DivisionErrors.PARENT_NOT_FOUND);
    }

    @Test
    @DisplayName("checkParentAssignment should accept a sibling subtree and the root level")
    void checkParentAssignment_shouldAccept_whenNoCycle() {
        assertThat(integrity.checkParentAssignment(3L, 4L)).isEmpty();
        assertThat(integrity.checkParentAssignment(3L, null)).isEmpty();
    }

    // ========================================
    // CYCLE WALK
    // ========================================

    @Test
    @DisplayName("wouldCreateCycle should follow deleted ancestors")
    void wouldCreateCycle_shouldFollowDeletedAncestors() {
        fx.addDeleted(5L, "MID", 3L, 10);
        fx.add(6L, "LEAF", 5L, 10);

        assertThat(integrity.wouldCreateCycle(1L, 6L)).isTrue();
    }

    @Test
    @DisplayName("wouldCreateCycle should treat a broken parent link as reaching a root")
    void wouldCreateCycle_shouldStopAtMissingAncestor() {
        fx.add(7L, "ORPHAN", 500L, 10);

        assertThat(integrity.wouldCreateCycle(1L, 7L)).isFalse();
    }

    @Test
    @DisplayName("wouldCreateCycle should fail fast when stored links already loop")
    void wouldCreateCycle_shouldThrow_whenStoredChainLoops() {
        fx.add(20L, "LOOP-A", 21L, 10);
        fx.add(21L, "LOOP-B", 20L, 10);

        assertThatThrownBy(() -> integrity.wouldCreateCycle(1L, 20L))
            .isInstanceOf(HierarchyIntegrityException.class)
            .hasMessageContaining("does not reach a root");
    }

    // ========================================
    // FIELD VALIDATION
    // ========================================

    @Test
    @DisplayName("checkFields should require code and name on create")
    void checkFields_shouldRequireCodeAndName_whenNotPartial() {
        assertThat(integrity.checkFields(null, "Name", null, false))
            .map(UseCaseError::code).contains("CODE_REQUIRED");
        assertThat(integrity.checkFields("CODE", "  ", null, false))
            .map(UseCaseError::code).contains("NAME_REQUIRED");
    }

    @Test
    @DisplayName("checkFields should reject values over the column limits")
    void checkFields_shouldRejectTooLongValues() {
        assertThat(integrity.checkFields("C".repeat(51), "Name", null, false))
            .map(UseCaseError::code).contains("CODE_TOO_LONG");
        assertThat(integrity.checkFields("CODE", "N".repeat(101), null, false))
            .map(UseCaseError::code).contains("NAME_TOO_LONG");
        assertThat(integrity.checkFields(null, null, "S".repeat(101), true))
            .map(UseCaseError::code).contains("SHORT_NAME_TOO_LONG");
    }

    @Test
    @DisplayName("checkFields should skip absent fields on partial updates")
    void checkFields_shouldSkipAbsentFields_whenPartial() {
        assertThat(integrity.checkFields(null, null, null, true)).isEmpty();
    }
}
