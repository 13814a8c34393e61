package com.streamfirst.migration.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Generic result type that represents either success with data or failure with a typed
 * {@link MigrationError}. Used for expected outcomes that the caller must branch on
 * (CAS conflicts, unavailable collaborators, invalid configuration).
 *
 * @param <T> the type of data returned on success
 */
@EqualsAndHashCode
public final class Result<T> {

    private final T data;
    private final MigrationError error;

    private Result(T data, MigrationError error) {
        this.data = data;
        this.error = error;
    }

    /**
     * Creates a successful result with data.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(data, null);
    }

    /**
     * Creates a failure result carrying the given error.
     */
    public static <T> Result<T> failure(@NonNull MigrationError error) {
        return new Result<>(null, error);
    }

    /**
     * Creates a failure result of the given kind.
     */
    public static <T> Result<T> failure(@NonNull ErrorKind kind, @NonNull String message) {
        return failure(new MigrationError(kind, message));
    }

    /**
     * Returns the data if successful, or throws {@link IllegalStateException} if failed.
     */
    public T orElseThrow() {
        if (isSuccess()) {
            return data;
        }
        throw new IllegalStateException(error.toString());
    }

    /**
     * Returns the data if successful, or the provided default value if failed.
     */
    public T orElse(T defaultValue) {
        return isSuccess() ? data : defaultValue;
    }

    /**
     * Returns the data if successful, or gets it from the provided supplier if failed.
     */
    public T orElseGet(Supplier<T> supplier) {
        return isSuccess() ? data : supplier.get();
    }

    /**
     * Maps the data to another type if successful, preserves failure if failed.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (isSuccess()) {
            return Result.success(mapper.apply(data));
        }
        return Result.failure(error);
    }

    /**
     * Flat maps the data to another Result if successful, preserves failure if failed.
     */
    public <U> Result<U> flatMap(Function<T, Result<U>> mapper) {
        if (isSuccess()) {
            return mapper.apply(data);
        }
        return Result.failure(error);
    }

    /**
     * Runs the action on the data if successful.
     */
    public Result<T> onSuccess(Consumer<T> action) {
        if (isSuccess()) {
            action.accept(data);
        }
        return this;
    }

    /**
     * Runs the action on the error if failed.
     */
    public Result<T> onFailure(Consumer<MigrationError> action) {
        if (isFailure()) {
            action.accept(error);
        }
        return this;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Checks whether this is a failure of the given kind.
     */
    public boolean isFailureOf(ErrorKind kind) {
        return error != null && error.kind() == kind;
    }

    /**
     * Gets the data if successful, empty otherwise.
     */
    public Optional<T> getData() {
        return isSuccess() ? Optional.of(data) : Optional.empty();
    }

    /**
     * Gets the error if failed, empty otherwise.
     */
    public Optional<MigrationError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + error + ")";
    }
}
