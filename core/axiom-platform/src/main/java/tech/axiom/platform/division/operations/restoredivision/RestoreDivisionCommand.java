package tech.axiom.platform.division.operations.restoredivision;

/**
 * Command to restore a soft-deleted division.
 *
 * @param divisionId Division to restore
 */
public record RestoreDivisionCommand(
    long divisionId
) {}
