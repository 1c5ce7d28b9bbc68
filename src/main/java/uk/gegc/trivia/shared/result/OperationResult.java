package uk.gegc.trivia.shared.result;

import uk.gegc.trivia.shared.exception.TriviaOperationException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or a single {@link ErrorKind}.
 *
 * <p>Operations report domain failures through this type instead of throwing.
 * Transport code calls {@link #orElseThrow()} at the boundary to turn a failure
 * into a {@link TriviaOperationException} for the exception handler.
 *
 * @param <T> type of the success value
 */
public sealed interface OperationResult<T> permits OperationResult.Success, OperationResult.Failure {

    static <T> OperationResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> OperationResult<T> failure(ErrorKind kind) {
        return new Failure<>(kind, kind.getDefaultMessage());
    }

    static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new Failure<>(kind, message);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Kind of the failure, empty for a success.
     */
    Optional<ErrorKind> errorKind();

    <U> OperationResult<U> map(Function<? super T, ? extends U> mapper);

    <U> OperationResult<U> flatMap(Function<? super T, OperationResult<U>> mapper);

    T orElse(T fallback);

    /**
     * Returns the value or throws a {@link TriviaOperationException} carrying the failure kind.
     */
    T orElseThrow();

    record Success<T>(T value) implements OperationResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ErrorKind> errorKind() {
            return Optional.empty();
        }

        @Override
        public <U> OperationResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> OperationResult<U> flatMap(Function<? super T, OperationResult<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public T orElse(T fallback) {
            return value;
        }

        @Override
        public T orElseThrow() {
            return value;
        }
    }

    record Failure<T>(ErrorKind kind, String message) implements OperationResult<T> {

        public Failure {
            Objects.requireNonNull(kind, "kind");
            if (message == null || message.isBlank()) {
                message = kind.getDefaultMessage();
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<ErrorKind> errorKind() {
            return Optional.of(kind);
        }

        @Override
        public <U> OperationResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(kind, message);
        }

        @Override
        public <U> OperationResult<U> flatMap(Function<? super T, OperationResult<U>> mapper) {
            return new Failure<>(kind, message);
        }

        @Override
        public T orElse(T fallback) {
            return fallback;
        }

        @Override
        public T orElseThrow() {
            throw new TriviaOperationException(kind, message);
        }
    }
}
