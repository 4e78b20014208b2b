package tech.axiom.platform.division;

import tech.axiom.platform.common.RecordingUnitOfWork;

/**
 * Engines wired to an {@link InMemoryDivisionRepository}, with a sort order step of 10.
 */
public class DivisionTestFixture {

    public final InMemoryDivisionRepository repo = new InMemoryDivisionRepository();
    public final RecordingUnitOfWork unitOfWork = new RecordingUnitOfWork(repo);
    public final DivisionIntegrity integrity = new DivisionIntegrity();
    public final DivisionOrdering ordering = new DivisionOrdering();
    public final DivisionHierarchy hierarchy = new DivisionHierarchy();

    public DivisionTestFixture() {
        integrity.divisionRepo = repo;
        ordering.divisionRepo = repo;
        ordering.config = () -> 10;
        hierarchy.divisionRepo = repo;
    }

    public Division add(long id, String code, Long parentId, int sortOrder) {
        return add(id, code, code + " Division", parentId, sortOrder);
    }

    public Division add(long id, String code, String name, Long parentId, int sortOrder) {
        Division division = new Division(id, code, name, parentId, sortOrder);
        repo.put(division);
        return division;
    }

    public Division addDeleted(long id, String code, Long parentId, int sortOrder) {
        Division division = new Division(id, code, code + " Division", parentId, sortOrder);
        division.deleted = true;
        repo.put(division);
        return division;
    }

    public Division get(long id) {
        return repo.findById(id, true).orElseThrow();
    }
}
