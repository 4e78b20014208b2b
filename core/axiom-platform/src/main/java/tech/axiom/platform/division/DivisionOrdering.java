package tech.axiom.platform.division;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assigns and renumbers sibling sort orders.
 */
@ApplicationScoped
public class DivisionOrdering {

    private static final Logger LOG = Logger.getLogger(DivisionOrdering.class);

    @Inject
    DivisionRepository divisionRepo;

    @Inject
    DivisionConfig config;

    /**
     * Sort order for a new member of the sibling group under {@code parentId}
     * (null for roots): one step past the current maximum, or one step if the group is empty.
     */
    public int nextSortOrder(Long parentId) {
        return nextSortOrder(parentId, null);
    }

    /**
     * As {@link #nextSortOrder(Long)}, ignoring {@code excludingId}, which is the division
     * being moved into the group.
     */
    public int nextSortOrder(Long parentId, Long excludingId) {
        int step = config.sortOrderStep();
        return divisionRepo.maxSortOrder(parentId, excludingId)
            .map(max -> max + step)
            .orElse(step);
    }

    /**
     * Space the non-deleted children of {@code parentId} evenly, keeping their current
     * {@code (sortOrder, name)} order. Nothing is saved here.
     *
     * @param parentId    the sibling group, null for roots
     * @param excludingId division to leave out (one that has just left the group), or null
     * @return the divisions whose sort order changed
     */
    public List<Division> renumberSiblings(Long parentId, Long excludingId) {
        int step = config.sortOrderStep();
        List<Division> changed = new ArrayList<>();
        int position = 0;

        for (Division sibling : divisionRepo.findByParent(parentId, false)) {
            if (Objects.equals(sibling.id, excludingId)) {
                continue;
            }
            int sortOrder = ++position * step;
            if (sibling.sortOrder != sortOrder) {
                sibling.sortOrder = sortOrder;
                sibling.updatedAt = Instant.now();
                changed.add(sibling);
            }
        }

        LOG.debugf("Renumbered %d of %d siblings under parent [%s]", changed.size(), position, parentId);
        return changed;
    }
}
