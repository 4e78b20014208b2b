package tech.axiom.platform.division.operations.updatedivision;

/**
 * Command to update a division. Null fields are left unchanged.
 *
 * @param divisionId     Division to update
 * @param code           New code
 * @param name           New name
 * @param shortName      New short name
 * @param parentId       New parent; 0 makes the division a root
 * @param sortOrder      New sort order, applied as given
 * @param internal       New internal flag
 * @param active         New active flag
 * @param clearShortName Remove the short name; takes precedence over {@code shortName}
 */
public record UpdateDivisionCommand(
    long divisionId,
    String code,
    String name,
    String shortName,
    Long parentId,
    Integer sortOrder,
    Boolean internal,
    Boolean active,
    boolean clearShortName
) {

    public UpdateDivisionCommand(long divisionId, String code, String name, String shortName,
                                 Long parentId, Integer sortOrder, Boolean internal, Boolean active) {
        this(divisionId, code, name, shortName, parentId, sortOrder, internal, active, false);
    }
}
