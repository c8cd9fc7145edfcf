package com.example.codescan.error;

import java.util.Objects;

/**
 * A failure signal delivered to {@code ScanListener#onFailure}.
 *
 * @param kind    taxonomy entry, never null
 * @param message human-readable detail
 * @param cause   underlying error, may be null
 */
public record ScanFailure(ScanFailureKind kind, String message, Throwable cause) {

    public ScanFailure {
        Objects.requireNonNull(kind, "kind");
        message = (message == null) ? kind.code() : message;
    }

    public static ScanFailure of(ScanFailureKind kind, String message) {
        return new ScanFailure(kind, message, null);
    }

    public static ScanFailure of(ScanFailureKind kind, String message, Throwable cause) {
        return new ScanFailure(kind, message, cause);
    }

    /** Wraps a {@link ScanException}, keeping its kind. */
    public static ScanFailure from(ScanException e) {
        return new ScanFailure(e.getKind(), e.getMessage(), e);
    }

    public boolean recoverable() {
        return kind.recoverable();
    }
}
