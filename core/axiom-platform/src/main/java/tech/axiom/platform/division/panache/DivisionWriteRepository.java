package tech.axiom.platform.division.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.axiom.platform.division.Division;
import tech.axiom.platform.division.entity.DivisionEntity;
import tech.axiom.platform.division.mapper.DivisionMapper;

import java.time.Instant;

/**
 * Write-side repository for Division entities.
 * Extends PanacheRepositoryBase for efficient entity persistence.
 */
@ApplicationScoped
public class DivisionWriteRepository implements PanacheRepositoryBase<DivisionEntity, Long> {

    /**
     * Insert the division if its ID is unknown, otherwise copy its state onto the managed entity.
     */
    public Division saveDivision(Division division) {
        Instant now = Instant.now();
        division.updatedAt = now;

        DivisionEntity existing = findById(division.id);
        if (existing != null) {
            DivisionMapper.updateEntity(existing, division);
            return division;
        }

        if (division.createdAt == null) {
            division.createdAt = now;
        }
        persist(DivisionMapper.toEntity(division));
        return division;
    }

    /**
     * Delete a division row by ID.
     */
    public boolean deleteDivisionById(long id) {
        return deleteById(id);
    }
}
