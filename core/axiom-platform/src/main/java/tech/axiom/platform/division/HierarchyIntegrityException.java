package tech.axiom.platform.division;

/**
 * Thrown when stored parent links are inconsistent (e.g. a parent chain longer than
 * the number of divisions, which can only happen if a cycle was written by something
 * other than this service).
 *
 * <p>This is an infrastructure failure, not a business error, and aborts the
 * surrounding transaction.
 */
public class HierarchyIntegrityException extends RuntimeException {

    private final long divisionId;

    public HierarchyIntegrityException(long divisionId, String message) {
        super(message);
        this.divisionId = divisionId;
    }

    public long getDivisionId() {
        return divisionId;
    }
}
