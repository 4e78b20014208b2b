package tech.axiom.platform.division.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * JPA entity for divisions table.
 *
 * <p>The partial unique index on {@code upper(code) WHERE is_deleted = false} lives in
 * the Flyway migration; JPA cannot express it.
 */
@Entity
@Table(name = "divisions", indexes = {
    @Index(name = "idx_divisions_parent_id", columnList = "parent_id")
})
public class DivisionEntity {

    @Id
    @Column(name = "id")
    public Long id;

    @Column(name = "code", nullable = false, length = 50)
    public String code;

    @Column(name = "name", nullable = false, length = 100)
    public String name;

    @Column(name = "short_name", length = 100)
    public String shortName;

    @Column(name = "parent_id")
    public Long parentId;

    @Column(name = "sort_order", nullable = false)
    public int sortOrder;

    @Column(name = "is_internal", nullable = false)
    public boolean internal;

    @Column(name = "is_active", nullable = false)
    public boolean active;

    @Column(name = "is_deleted", nullable = false)
    public boolean deleted;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public DivisionEntity() {
    }
}
