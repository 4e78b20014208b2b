package tech.axiom.platform.division.operations.createdivision;

/**
 * Command to create a new division.
 *
 * @param code      Business code, unique among non-deleted divisions (stored upper-cased)
 * @param name      Display name
 * @param shortName Optional abbreviated name
 * @param parentId  Parent division, null or 0 for a root division
 * @param sortOrder Position among siblings; null or 0 places it after the last sibling
 * @param internal  Internal flag, defaults to false
 * @param active    Active flag, defaults to true
 */
public record CreateDivisionCommand(
    String code,
    String name,
    String shortName,
    Long parentId,
    Integer sortOrder,
    Boolean internal,
    Boolean active
) {}
