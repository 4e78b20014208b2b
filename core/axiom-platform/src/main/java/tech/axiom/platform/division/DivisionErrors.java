package tech.axiom.platform.division;

import tech.axiom.platform.common.errors.UseCaseError;

import java.util.Map;

/**
 * Factory for the division error kinds returned by use cases.
 */
public final class DivisionErrors {

    public static final String DIVISION_NOT_FOUND = "DIVISION_NOT_FOUND";
    public static final String CODE_EXISTS = "CODE_EXISTS";
    public static final String PARENT_NOT_FOUND = "PARENT_NOT_FOUND";
    public static final String SELF_PARENT = "SELF_PARENT";
    public static final String CIRCULAR_REFERENCE = "CIRCULAR_REFERENCE";
    public static final String HAS_CHILDREN = "HAS_CHILDREN";
    public static final String DIVISION_NOT_DELETED = "DIVISION_NOT_DELETED";

    private DivisionErrors() {
    }

    public static UseCaseError notFound(long divisionId) {
        return new UseCaseError.NotFoundError(
            DIVISION_NOT_FOUND,
            "Division with ID " + divisionId + " not found",
            Map.of("divisionId", divisionId)
        );
    }

    public static UseCaseError codeExists(String code) {
        return new UseCaseError.BusinessRuleViolation(
            CODE_EXISTS,
            "Division with code '" + code + "' already exists",
            Map.of("code", code)
        );
    }

    public static UseCaseError parentNotFound(long parentId) {
        return new UseCaseError.BusinessRuleViolation(
            PARENT_NOT_FOUND,
            "Parent division with ID " + parentId + " not found",
            Map.of("parentId", parentId)
        );
    }

    public static UseCaseError selfParent(long divisionId) {
        return new UseCaseError.BusinessRuleViolation(
            SELF_PARENT,
            "Division cannot be its own parent",
            Map.of("divisionId", divisionId)
        );
    }

    public static UseCaseError circularReference(long divisionId, long parentId) {
        return new UseCaseError.BusinessRuleViolation(
            CIRCULAR_REFERENCE,
            "Cannot create circular parent-child relationship",
            Map.of("divisionId", divisionId, "parentId", parentId)
        );
    }

    public static UseCaseError hasChildren(long divisionId, long childrenCount) {
        return new UseCaseError.BusinessRuleViolation(
            HAS_CHILDREN,
            "Cannot delete division with " + childrenCount + " child divisions",
            Map.of("divisionId", divisionId, "childrenCount", childrenCount)
        );
    }

    public static UseCaseError notDeleted(long divisionId) {
        return new UseCaseError.BusinessRuleViolation(
            DIVISION_NOT_DELETED,
            "Division with ID " + divisionId + " is not deleted",
            Map.of("divisionId", divisionId)
        );
    }

    public static UseCaseError validation(String code, String message, Map<String, Object> details) {
        return new UseCaseError.ValidationError(code, message, details);
    }
}
