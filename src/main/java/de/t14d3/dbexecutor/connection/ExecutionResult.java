package de.t14d3.dbexecutor.connection;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a call run in a {@link Session}: either the value the call produced,
 * or the error that made its transaction roll back.
 * <p>
 * A successful result may carry a zero or empty value; only {@link #isFailure()}
 * says that something went wrong.
 */
public final class ExecutionResult<T> {
    private final T value;
    private final Throwable error;

    private ExecutionResult(T value, Throwable error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ExecutionResult<T> success(T value) {
        return new ExecutionResult<>(value, null);
    }

    public static <T> ExecutionResult<T> failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new ExecutionResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * @throws NoSuchElementException if this is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("Execution failed: " + error);
        }
        return value;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public T orElse(T other) {
        return error == null ? value : other;
    }

    /**
     * Returns the value, or throws the exception built from the error.
     */
    public <X extends RuntimeException> T orElseThrow(Function<Throwable, X> exceptionFactory) {
        if (error != null) {
            throw exceptionFactory.apply(error);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
