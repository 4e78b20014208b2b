package tech.axiom.platform.common;

import tech.axiom.platform.common.errors.UseCaseError;

/**
 * Result type for use case execution.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - contains the successful result value</li>
 *   <li>{@link Failure} - contains the error details</li>
 * </ul>
 *
 * <p>Business rule failures are returned, never thrown. Successful results are
 * produced by {@link UnitOfWork} once the aggregate and its audit entry have
 * been written.
 *
 * <p>Usage in API layer:
 * <pre>{@code
 * if (result instanceof Result.Failure<DivisionCreated> f) {
 *     return mapErrorToResponse(f.error());
 * }
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * Successful result containing the value.
     */
    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }
    }

    /**
     * Failed result containing the error.
     */
    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }
    }

    /**
     * Create a successful result.
     */
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * Create a failed result.
     */
    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
