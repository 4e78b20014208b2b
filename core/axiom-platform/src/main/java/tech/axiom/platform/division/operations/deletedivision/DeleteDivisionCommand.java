package tech.axiom.platform.division.operations.deletedivision;

/**
 * Command to delete a division.
 *
 * @param divisionId Division to delete
 * @param softDelete true to flag the division as deleted, false to remove the row
 */
public record DeleteDivisionCommand(
    long divisionId,
    boolean softDelete
) {}
