package tech.axiom.platform.division;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DivisionOrdering.
 */
class DivisionOrderingTest {

    private DivisionTestFixture fx;
    private DivisionOrdering ordering;

    @BeforeEach
    void setUp() {
        fx = new DivisionTestFixture();
        ordering = fx.ordering;
    }

    @Test
    @DisplayName("nextSortOrder should return one step for an empty sibling group")
    void nextSortOrder_shouldReturnStep_whenNoSiblings() {
        assertThat(ordering.nextSortOrder(null)).isEqualTo(10);
    }

    @Test
    @DisplayName("nextSortOrder should return max plus one step")
    void nextSortOrder_shouldReturnMaxPlusStep() {
        fx.add(1L, "HQ", null, 10);
        fx.add(2L, "A", 1L, 10);
        fx.add(3L, "B", 1L, 30);
        fx.add(4L, "C", 1L, 20);

        assertThat(ordering.nextSortOrder(1L)).isEqualTo(40);
        assertThat(ordering.nextSortOrder(null)).isEqualTo(20);
    }

    @Test
    @DisplayName("nextSortOrder should count deleted siblings")
    void nextSortOrder_shouldIncludeDeletedSiblings() {
        fx.add(1L, "HQ", null, 10);
        fx.addDeleted(2L, "OLD", 1L, 50);

        assertThat(ordering.nextSortOrder(1L)).isEqualTo(60);
    }

    @Test
    @DisplayName("nextSortOrder should ignore the excluded division")
    void nextSortOrder_shouldIgnoreExcludedDivision() {
        fx.add(1L, "HQ", null, 10);
        fx.add(2L, "A", 1L, 10);
        fx.add(3L, "B", 1L, 90);

        assertThat(ordering.nextSortOrder(1L, 3L)).isEqualTo(20);
    }

    @Test
    @DisplayName("nextSortOrder should use the configured step")
    void nextSortOrder_shouldUseConfiguredStep() {
        ordering.config = () -> 100;
        fx.add(1L, "HQ", null, 100);

        assertThat(ordering.nextSortOrder(null)).isEqualTo(200);
    }

    @Test
    @DisplayName("renumberSiblings should close gaps and keep the current order")
    void renumberSiblings_shouldCloseGaps() {
        fx.add(1L, "HQ", null, 10);
        fx.add(2L, "A", "Alpha", 1L, 10);
        fx.add(3L, "B", "Bravo", 1L, 40);
        fx.add(4L, "C", "Charlie", 1L, 40);
        fx.add(5L, "D", "Delta", 1L, 70);

        List<Division> changed = ordering.renumberSiblings(1L, null);

        assertThat(changed).extracting(d -> d.id).containsExactly(3L, 4L, 5L);
        assertThat(changed).extracting(d -> d.sortOrder).containsExactly(20, 30, 40);
    }

    @Test
    @DisplayName("renumberSiblings should skip the excluded division and deleted siblings")
    void renumberSiblings_shouldSkipExcludedAndDeleted() {
        fx.add(1L, "HQ", null, 10);
        fx.add(2L, "A", 1L, 10);
        fx.add(3L, "MOVED", 1L, 20);
        fx.addDeleted(4L, "OLD", 1L, 25);
        fx.add(5L, "C", 1L, 30);

        List<Division> changed = ordering.renumberSiblings(1L, 3L);

        assertThat(changed).hasSize(1);
        assertThat(changed.get(0).id).isEqualTo(5L);
        assertThat(changed.get(0).sortOrder).isEqualTo(20);
    }

    @Test
    @DisplayName("renumberSiblings should not save anything itself")
    void renumberSiblings_shouldNotPersist() {
        fx.add(1L, "A", null, 50);

        ordering.renumberSiblings(null, null);

        assertThat(fx.get(1L).sortOrder).isEqualTo(50);
    }
}
