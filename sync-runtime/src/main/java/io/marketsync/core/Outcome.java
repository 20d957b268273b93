package io.marketsync.core;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of an operation that can produce a value, legitimately produce nothing, or fail.
 * Callers branch on {@link #status()} instead of interpreting null or empty collections.
 * <p>
 * A {@code NO_DATA} outcome may still carry the last error when it was produced by exhausting retries;
 * see {@link #exhausted()}.
 */
public final class Outcome<T> {
    public enum Status { SUCCESS, NO_DATA, FAILURE }

    private static final Outcome<?> EMPTY = new Outcome<>(Status.NO_DATA, null, null, 0);

    private final Status status;
    private final T value;
    private final Exception error;
    private final int attempts;

    private Outcome(Status status, T value, Exception error, int attempts) {
        this.status = status;
        this.value = value;
        this.error = error;
        this.attempts = attempts;
    }

    public static <T> Outcome<T> success(T value) {
        return success(value, 1);
    }

    public static <T> Outcome<T> success(T value, int attempts) {
        return new Outcome<>(Status.SUCCESS, Objects.requireNonNull(value, "value"), null, attempts);
    }

    @SuppressWarnings("unchecked")
    public static <T> Outcome<T> noData() {
        return (Outcome<T>) EMPTY;
    }

    public static <T> Outcome<T> noData(int attempts) {
        return new Outcome<>(Status.NO_DATA, null, null, attempts);
    }

    /** No data because every attempt failed; the last failure is kept for reporting. */
    public static <T> Outcome<T> exhausted(Exception lastError, int attempts) {
        return new Outcome<>(Status.NO_DATA, null, Objects.requireNonNull(lastError, "lastError"), attempts);
    }

    public static <T> Outcome<T> failure(Exception error) {
        return new Outcome<>(Status.FAILURE, null, Objects.requireNonNull(error, "error"), 0);
    }

    public Status status() { return status; }
    public boolean isSuccess() { return status == Status.SUCCESS; }
    public boolean isNoData() { return status == Status.NO_DATA; }
    public boolean isFailure() { return status == Status.FAILURE; }
    public boolean exhausted() { return status == Status.NO_DATA && error != null; }
    public int attempts() { return attempts; }

    public T value() {
        if (status != Status.SUCCESS) throw new NoSuchElementException("no value for outcome " + status);
        return value;
    }

    public Optional<Exception> error() { return Optional.ofNullable(error); }

    @Override
    public String toString() {
        return switch (status) {
            case SUCCESS -> "Success{" + value + '}';
            case NO_DATA -> error == null ? "NoData" : "NoData{exhausted after " + attempts + " attempts: " + error + '}';
            case FAILURE -> "Failure{" + error + '}';
        };
    }
}
