package tech.axiom.platform.division.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.DivisionFilter;
import tech.axiom.platform.division.DivisionRepository;
import tech.axiom.platform.division.entity.DivisionEntity;
import tech.axiom.platform.division.mapper.DivisionMapper;
import tech.axiom.platform.shared.Instrumented;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-side repository for Division entities.
 * Uses EntityManager directly to return domain objects; writes delegate to
 * {@link DivisionWriteRepository}.
 */
@ApplicationScoped
@Instrumented(table = "divisions")
public class DivisionReadRepository implements DivisionRepository {

    private static final String SIBLING_ORDER = " ORDER BY e.sortOrder, e.name, e.id";

    @Inject
    EntityManager em;

    @Inject
    DivisionWriteRepository writeRepo;

    @Override
    public Optional<Division> findById(long id, boolean includeDeleted) {
        DivisionEntity entity = em.find(DivisionEntity.class, id);
        if (entity == null || (entity.deleted && !includeDeleted)) {
            return Optional.empty();
        }
        return Optional.of(DivisionMapper.toDomain(entity));
    }

    @Override
    public Optional<Division> findByCode(String code, boolean includeDeleted) {
        if (code == null) {
            return Optional.empty();
        }
        String jpql = "FROM DivisionEntity e WHERE upper(e.code) = :code"
            + (includeDeleted ? "" : " AND e.deleted = false")
            + " ORDER BY e.deleted, e.id";
        return em.createQuery(jpql, DivisionEntity.class)
            .setParameter("code", Division.normalizeCode(code))
            .setMaxResults(1)
            .getResultList()
            .stream()
            .findFirst()
            .map(DivisionMapper::toDomain);
    }

    @Override
    public List<Division> findByParent(Long parentId, boolean includeDeleted) {
        StringBuilder jpql = new StringBuilder("FROM DivisionEntity e WHERE ");
        jpql.append(parentId == null ? "e.parentId IS NULL" : "e.parentId = :parentId");
        if (!includeDeleted) {
            jpql.append(" AND e.deleted = false");
        }
        jpql.append(SIBLING_ORDER);

        TypedQuery<DivisionEntity> query = em.createQuery(jpql.toString(), DivisionEntity.class);
        if (parentId != null) {
            query.setParameter("parentId", parentId);
        }
        return query.getResultList().stream()
            .map(DivisionMapper::toDomain)
            .toList();
    }

    @Override
    public List<Division> findRoots(boolean includeDeleted) {
        return findByParent(null, includeDeleted);
    }

    @Override
    public List<Division> search(DivisionFilter filter, int skip, int limit) {
        return filteredQuery(filter)
            .setFirstResult(skip)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(DivisionMapper::toDomain)
            .toList();
    }

    @Override
    public List<Division> list(DivisionFilter filter) {
        return filteredQuery(filter)
            .getResultList()
            .stream()
            .map(DivisionMapper::toDomain)
            .toList();
    }

    @Override
    public long count(DivisionFilter filter) {
        Map<String, Object> params = new HashMap<>();
        String where = whereClause(filter, params);
        TypedQuery<Long> query = em.createQuery("SELECT COUNT(e) FROM DivisionEntity e" + where, Long.class);
        params.forEach(query::setParameter);
        return query.getSingleResult();
    }

    @Override
    public boolean existsActiveCode(String code, Long excludingId) {
        String jpql = "SELECT COUNT(e) FROM DivisionEntity e WHERE upper(e.code) = :code AND e.deleted = false"
            + (excludingId != null ? " AND e.id <> :excludingId" : "");
        TypedQuery<Long> query = em.createQuery(jpql, Long.class)
            .setParameter("code", Division.normalizeCode(code));
        if (excludingId != null) {
            query.setParameter("excludingId", excludingId);
        }
        return query.getSingleResult() > 0;
    }

    @Override
    public long countChildren(long parentId) {
        return em.createQuery(
                "SELECT COUNT(e) FROM DivisionEntity e WHERE e.parentId = :parentId AND e.deleted = false",
                Long.class)
            .setParameter("parentId", parentId)
            .getSingleResult();
    }

    @Override
    public Optional<Integer> maxSortOrder(Long parentId, Long excludingId) {
        StringBuilder jpql = new StringBuilder("SELECT MAX(e.sortOrder) FROM DivisionEntity e WHERE ");
        jpql.append(parentId == null ? "e.parentId IS NULL" : "e.parentId = :parentId");
        if (excludingId != null) {
            jpql.append(" AND e.id <> :excludingId");
        }

        TypedQuery<Integer> query = em.createQuery(jpql.toString(), Integer.class);
        if (parentId != null) {
            query.setParameter("parentId", parentId);
        }
        if (excludingId != null) {
            query.setParameter("excludingId", excludingId);
        }
        return Optional.ofNullable(query.getSingleResult());
    }

    @Override
    public long countAll() {
        return em.createQuery("SELECT COUNT(e) FROM DivisionEntity e", Long.class).getSingleResult();
    }

    @Override
    public List<String> findActiveCodes() {
        return em.createQuery(
                "SELECT e.code FROM DivisionEntity e WHERE e.deleted = false AND e.active = true",
                String.class)
            .getResultList();
    }

    // Write operations delegate to WriteRepository
    @Override
    public Division save(Division division) {
        return writeRepo.saveDivision(division);
    }

    @Override
    public void delete(long id) {
        writeRepo.deleteDivisionById(id);
    }

    private TypedQuery<DivisionEntity> filteredQuery(DivisionFilter filter) {
        Map<String, Object> params = new HashMap<>();
        String where = whereClause(filter, params);
        TypedQuery<DivisionEntity> query = em.createQuery(
            "SELECT e FROM DivisionEntity e" + where + SIBLING_ORDER, DivisionEntity.class);
        params.forEach(query::setParameter);
        return query;
    }

    private static String whereClause(DivisionFilter filter, Map<String, Object> params) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        if (!filter.includeDeleted()) {
            where.append(" AND e.deleted = false");
        }
        if (filter.activeOnly()) {
            where.append(" AND e.active = true");
        }
        if (filter.hasQuery()) {
            where.append(" AND (lower(e.code) LIKE :query OR lower(e.name) LIKE :query"
                + " OR lower(e.shortName) LIKE :query)");
            params.put("query", "%" + filter.query().trim().toLowerCase(Locale.ROOT) + "%");
        }
        return where.toString();
    }
}
