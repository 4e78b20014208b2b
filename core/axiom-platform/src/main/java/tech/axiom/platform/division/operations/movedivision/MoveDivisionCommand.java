package tech.axiom.platform.division.operations.movedivision;

/**
 * Command to move a division within the hierarchy.
 *
 * @param divisionId   Division to move
 * @param newParentId  New parent; null or 0 moves it to the top level
 * @param newSortOrder Position among the new siblings; null places it after the last one
 */
public record MoveDivisionCommand(
    long divisionId,
    Long newParentId,
    Integer newSortOrder
) {}
