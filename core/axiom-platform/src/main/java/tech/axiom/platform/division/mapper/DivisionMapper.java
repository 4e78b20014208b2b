package tech.axiom.platform.division.mapper;

import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.entity.DivisionEntity;

/**
 * Mapper for converting between Division domain model and JPA entity.
 */
public final class DivisionMapper {

    private DivisionMapper() {
    }

    public static Division toDomain(DivisionEntity entity) {
        if (entity == null) {
            return null;
        }

        Division domain = new Division();
        domain.id = entity.id;
        domain.code = entity.code;
        domain.name = entity.name;
        domain.shortName = entity.shortName;
        domain.parentId = entity.parentId;
        domain.sortOrder = entity.sortOrder;
        domain.internal = entity.internal;
        domain.active = entity.active;
        domain.deleted = entity.deleted;
        domain.createdAt = entity.createdAt;
        domain.updatedAt = entity.updatedAt;
        return domain;
    }

    public static DivisionEntity toEntity(Division domain) {
        if (domain == null) {
            return null;
        }

        DivisionEntity entity = new DivisionEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    public static void updateEntity(DivisionEntity entity, Division domain) {
        entity.code = domain.code;
        entity.name = domain.name;
        entity.shortName = domain.shortName;
        entity.parentId = domain.parentId;
        entity.sortOrder = domain.sortOrder;
        entity.internal = domain.internal;
        entity.active = domain.active;
        entity.deleted = domain.deleted;
        entity.updatedAt = domain.updatedAt;
    }
}
