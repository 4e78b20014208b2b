package tech.axiom.platform.division;

import java.time.Instant;
import java.util.Locale;

/**
 * A node in the organizational hierarchy tree.
 *
 * <p>Divisions form a forest: a division with no {@link #parentId} is a root.
 * Siblings (divisions sharing a parent) are ordered by {@link #sortOrder}, then
 * by {@link #name}.
 *
 * <p>Soft-deleted divisions ({@link #deleted}) stay in the store for audit and
 * restore but are excluded from default queries and no longer claim their code.
 */
public class Division {

    public static final int CODE_MAX_LENGTH = 50;
    public static final int NAME_MAX_LENGTH = 100;
    public static final int SHORT_NAME_MAX_LENGTH = 100;

    public Long id;

    /**
     * Business code, stored upper-cased. Unique among non-deleted divisions.
     * Examples: "HQ", "ALPHA", "LOG-2"
     */
    public String code;

    public String name;

    public String shortName;

    /**
     * Parent division ID, or null for a root division.
     */
    public Long parentId;

    public int sortOrder;

    /**
     * Marks divisions internal to the organization. No structural effect.
     */
    public boolean internal;

    public boolean active = true;

    public boolean deleted;

    public Instant createdAt = Instant.now();

    public Instant updatedAt = Instant.now();

    public Division() {
    }

    public Division(Long id, String code, String name, Long parentId, int sortOrder) {
        this.id = id;
        this.code = code;
        this.name = name;
        this.parentId = parentId;
        this.sortOrder = sortOrder;
    }

    /**
     * Normalize a code for storage and comparison.
     *
     * @return the trimmed, upper-cased code, or null
     */
    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Normalize a parent reference. Zero is accepted as "no parent".
     */
    public static Long normalizeParentId(Long parentId) {
        return parentId == null || parentId == 0L ? null : parentId;
    }
}
