package tech.axiom.platform.division;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.axiom.platform.common.errors.UseCaseError;

import java.util.Map;
import java.util.Optional;

/**
 * Validates hierarchy invariants before a mutation is committed.
 *
 * <p>All checks are read-only. A check returns the error to report, or empty when
 * the mutation may proceed. Callers run them inside the same transaction as the
 * write that follows.
 */
@ApplicationScoped
public class DivisionIntegrity {

    private static final Logger LOG = Logger.getLogger(DivisionIntegrity.class);

    @Inject
    DivisionRepository divisionRepo;

    /**
     * Validate the free-text fields of a new or updated division. Null values are
     * skipped when {@code partial} is true.
     */
    public Optional<UseCaseError> checkFields(String code, String name, String shortName, boolean partial) {
        if (code != null || !partial) {
            if (code == null || code.isBlank()) {
                return Optional.of(DivisionErrors.validation(
                    "CODE_REQUIRED", "Division code is required", Map.of()));
            }
            if (code.trim().length() > Division.CODE_MAX_LENGTH) {
                return Optional.of(DivisionErrors.validation(
                    "CODE_TOO_LONG",
                    "Division code must be at most " + Division.CODE_MAX_LENGTH + " characters",
                    Map.of("length", code.trim().length())));
            }
        }

        if (name != null || !partial) {
            if (name == null || name.isBlank()) {
                return Optional.of(DivisionErrors.validation(
                    "NAME_REQUIRED", "Division name is required", Map.of()));
            }
            if (name.length() > Division.NAME_MAX_LENGTH) {
                return Optional.of(DivisionErrors.validation(
                    "NAME_TOO_LONG",
                    "Division name must be at most " + Division.NAME_MAX_LENGTH + " characters",
                    Map.of("length", name.length())));
            }
        }

        if (shortName != null && shortName.length() > Division.SHORT_NAME_MAX_LENGTH) {
            return Optional.of(DivisionErrors.validation(
                "SHORT_NAME_TOO_LONG",
                "Division short name must be at most " + Division.SHORT_NAME_MAX_LENGTH + " characters",
                Map.of("length", shortName.length())));
        }

        return Optional.empty();
    }

    /**
     * @param code        normalized code
     * @param excludingId division allowed to hold the code (the one being updated), or null
     */
    public Optional<UseCaseError> checkCodeAvailable(String code, Long excludingId) {
        if (divisionRepo.existsActiveCode(code, excludingId)) {
            return Optional.of(DivisionErrors.codeExists(code));
        }
        return Optional.empty();
    }

    /**
     * The parent must exist, deleted or not.
     */
    public Optional<UseCaseError> checkParentExists(long parentId) {
        if (divisionRepo.findById(parentId, true).isEmpty()) {
            return Optional.of(DivisionErrors.parentNotFound(parentId));
        }
        return Optional.empty();
    }

    /**
     * Check that {@code newParentId} may become the parent of {@code divisionId}.
     * A null parent (root) is always allowed.
     */
    public Optional<UseCaseError> checkParentAssignment(long divisionId, Long newParentId) {
        if (newParentId == null) {
            return Optional.empty();
        }
        if (newParentId == divisionId) {
            return Optional.of(DivisionErrors.selfParent(divisionId));
        }

        Optional<UseCaseError> parentError = checkParentExists(newParentId);
        if (parentError.isPresent()) {
            return parentError;
        }

        if (wouldCreateCycle(divisionId, newParentId)) {
            return Optional.of(DivisionErrors.circularReference(divisionId, newParentId));
        }
        return Optional.empty();
    }

    /**
     * Walk the ancestor chain of {@code newParentId} looking for {@code divisionId}.
     *
     * <p>Deleted ancestors are followed. A missing record ends the walk as if a root had
     * been reached. The walk cannot take more steps than there are divisions; if it does,
     * the stored links already contain a cycle.
     *
     * @throws HierarchyIntegrityException if the chain does not terminate
     */
    public boolean wouldCreateCycle(long divisionId, long newParentId) {
        long limit = divisionRepo.countAll();
        long steps = 0;
        Long current = newParentId;

        while (current != null) {
            if (current == divisionId) {
                LOG.debugf("Parent [%d] for division [%d] is one of its descendants", newParentId, divisionId);
                return true;
            }
            if (++steps > limit) {
                throw new HierarchyIntegrityException(current,
                    "Parent chain starting at division " + newParentId + " does not reach a root");
            }

            Optional<Division> ancestor = divisionRepo.findById(current, true);
            if (ancestor.isEmpty()) {
                LOG.debugf("Parent chain of division [%d] ends at missing division [%d]", newParentId, current);
                return false;
            }
            current = ancestor.get().parentId;
        }
        return false;
    }
}
