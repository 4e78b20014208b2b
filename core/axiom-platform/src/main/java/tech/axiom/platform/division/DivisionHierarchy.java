package tech.axiom.platform.division;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Read-side queries over the division tree.
 */
@ApplicationScoped
public class DivisionHierarchy {

    private static final Logger LOG = Logger.getLogger(DivisionHierarchy.class);

    @Inject
    DivisionRepository divisionRepo;

    /**
     * Direct children of a division, ordered by {@code (sortOrder, name)}.
     */
    public List<Division> getChildren(long parentId, boolean includeDeleted) {
        return divisionRepo.findByParent(parentId, includeDeleted);
    }

    /**
     * Flattened subtree in depth-first pre-order: every division appears before its
     * children, and children keep their sibling order.
     *
     * <p>Without a root ({@code null} or 0), only the non-deleted top-level divisions are returned; they are
     * not expanded. An unknown or deleted root yields an empty list.
     */
    public List<Division> getHierarchyTree(Long rootId) {
        Long rootDivisionId = Division.normalizeParentId(rootId);
        if (rootDivisionId == null) {
            return divisionRepo.findRoots(false);
        }

        Optional<Division> root = divisionRepo.findById(rootDivisionId, false);
        if (root.isEmpty()) {
            return List.of();
        }

        List<Division> tree = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        Deque<Division> stack = new ArrayDeque<>();
        stack.push(root.get());

        while (!stack.isEmpty()) {
            Division division = stack.pop();
            if (!visited.add(division.id)) {
                LOG.warnf("Division [%d] reached twice while expanding tree rooted at [%d], skipping",
                    division.id, rootDivisionId);
                continue;
            }
            tree.add(division);

            List<Division> children = divisionRepo.findByParent(division.id, false);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return tree;
    }

    /**
     * Codes held by non-deleted, active divisions, sorted ascending.
     *
     * @param prefix optional prefix, matched against the upper-cased code
     */
    public List<String> getAvailableCodes(String prefix) {
        String normalizedPrefix = prefix == null || prefix.isBlank()
            ? null
            : prefix.trim().toUpperCase(Locale.ROOT);

        return divisionRepo.findActiveCodes().stream()
            .filter(code -> normalizedPrefix == null || code.startsWith(normalizedPrefix))
            .sorted()
            .toList();
    }
}
