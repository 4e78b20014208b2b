package tech.axiom.platform.division;

/**
 * Filter for division listings.
 *
 * @param includeDeleted include soft-deleted divisions
 * @param activeOnly     only divisions with {@code active = true}
 * @param query          free text matched case-insensitively against code, name and short name
 */
public record DivisionFilter(boolean includeDeleted, boolean activeOnly, String query) {

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }
}
