package tech.axiom.platform.division;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Division entities.
 *
 * <p>Every read that takes {@code includeDeleted} filters to {@code deleted = false}
 * when the flag is false. Ordered reads sort by {@code (sortOrder, name)}.
 */
public interface DivisionRepository {

    // Read operations
    Optional<Division> findById(long id, boolean includeDeleted);

    /**
     * Case-insensitive lookup by code.
     */
    Optional<Division> findByCode(String code, boolean includeDeleted);

    /**
     * Direct children of a parent; a null parent selects root divisions.
     */
    List<Division> findByParent(Long parentId, boolean includeDeleted);

    /**
     * Root divisions, ordered like {@link #findByParent}.
     */
    List<Division> findRoots(boolean includeDeleted);

    List<Division> search(DivisionFilter filter, int skip, int limit);
    List<Division> list(DivisionFilter filter);
    long count(DivisionFilter filter);

    /**
     * Whether a non-deleted division other than {@code excludingId} holds the code
     * (case-insensitive).
     */
    boolean existsActiveCode(String code, Long excludingId);

    /**
     * Number of non-deleted divisions whose parent is {@code parentId}.
     */
    long countChildren(long parentId);

    /**
     * Highest sort order among all divisions (deleted included) under {@code parentId},
     * ignoring {@code excludingId}. Empty when the group has no members.
     */
    Optional<Integer> maxSortOrder(Long parentId, Long excludingId);

    /**
     * Total number of division rows, deleted included.
     */
    long countAll();

    /**
     * Codes of non-deleted, active divisions.
     */
    List<String> findActiveCodes();

    // Write operations
    Division save(Division division);
    void delete(long id);
}
