package com.yoursp.relay.service.storage;

/**
 * Result of a blob store call. Adapters never throw; a missing object and a
 * failing backend are reported as distinct failures.
 */
public final class BlobOutcome<T> {

    public enum Failure {
        NOT_FOUND,
        STORAGE
    }

    private final T value;
    private final Failure failure;
    private final String detail;

    private BlobOutcome(T value, Failure failure, String detail) {
        this.value = value;
        this.failure = failure;
        this.detail = detail;
    }

    public static <T> BlobOutcome<T> ok(T value) {
        return new BlobOutcome<>(value, null, null);
    }

    public static <T> BlobOutcome<T> notFound(String key) {
        return new BlobOutcome<>(null, Failure.NOT_FOUND, "No object at " + key);
    }

    public static <T> BlobOutcome<T> storageError(String detail) {
        return new BlobOutcome<>(null, Failure.STORAGE, detail);
    }

    public boolean isOk() {
        return failure == null;
    }

    public boolean isNotFound() {
        return failure == Failure.NOT_FOUND;
    }

    public T getValue() {
        if (!isOk()) {
            throw new IllegalStateException("No value on failed blob outcome: " + failure);
        }
        return value;
    }

    public Failure getFailure() {
        return failure;
    }

    public String getDetail() {
        return detail;
    }
}
