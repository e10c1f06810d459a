package com.yoursp.relay.model;

import java.util.Objects;

/**
 * Result of a vault operation: either a value or an {@link ErrorKind} with a
 * message that is safe to hand back to callers.
 */
public final class VaultOutcome<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    private VaultOutcome(T value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> VaultOutcome<T> success(T value) {
        return new VaultOutcome<>(value, null, null);
    }

    public static <T> VaultOutcome<T> failure(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        return new VaultOutcome<>(null, kind, message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed outcome: " + errorKind + " - " + message);
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "VaultOutcome[success]" : "VaultOutcome[" + errorKind + ": " + message + "]";
    }
}
