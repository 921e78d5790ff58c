package com.openstay.common.result;

import com.openstay.common.exception.ErrorCode;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a core operation: either a value or exactly one tagged error.
 *
 * @param <T> Type of the success value
 */
public final class OperationResult<T> {

    private final T value;
    private final ErrorCode error;
    private final String message;

    private OperationResult(T value, ErrorCode error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorCode error, String message) {
        Objects.requireNonNull(error, "error");
        return new OperationResult<>(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Success value; fails fast when called on a failed result.
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + error.getTag());
        }
        return value;
    }

    public Optional<ErrorCode> getError() {
        return Optional.ofNullable(error);
    }

    public String getMessage() {
        return message;
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return failure(error, message);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "OperationResult[success=" + value + "]"
                : "OperationResult[" + error.getTag() + ": " + message + "]";
    }
}
