package tech.scytalesystems.tiered_cache_starter.remote;

import java.util.Objects;

/**
 * @author Gathariki Ngigi
 * Created on 25/11/2025
 * Time 0910h
 * <p>Outcome of a single call to a cache tier.
 * <p>- OK: the call succeeded; {@link #value()} holds the result (the payload for a read)
 * <p>- MISS: the key is not there
 * <p>- ERROR: the tier could not answer; {@link #error()} holds the cause
 *
 * <p>Remote clients never throw for tier failures, they return {@link Status#ERROR}.
 */
public final class TierResult<T> {
    private static final TierResult<?> MISS = new TierResult<>(Status.MISS, null, null);

    public enum Status {
        OK,
        MISS,
        ERROR
    }

    private final Status status;
    private final T value;
    private final Throwable error;

    private TierResult(Status status, T value, Throwable error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> TierResult<T> ok(T value) {
        return new TierResult<>(Status.OK, value, null);
    }

    @SuppressWarnings("unchecked")
    public static <T> TierResult<T> miss() {
        return (TierResult<T>) MISS;
    }

    public static <T> TierResult<T> error(Throwable error) {
        return new TierResult<>(Status.ERROR, null, Objects.requireNonNull(error, "error"));
    }

    public Status status() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isMiss() {
        return status == Status.MISS;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public T value() {
        return value;
    }

    public Throwable error() {
        return error;
    }

    @Override
    public String toString() {
        return switch (status) {
            case OK -> "TierResult{OK}";
            case MISS -> "TierResult{MISS}";
            case ERROR -> "TierResult{ERROR, error=" + error.getMessage() + "}";
        };
    }
}
