package com.example.codescan.error;

/**
 * A scan-core failure raised synchronously at the call that triggered it.
 */
public class ScanException extends RuntimeException {

    private final ScanFailureKind kind;

    public ScanException(ScanFailureKind kind, String message) {
        this(kind, message, null);
    }

    public ScanException(ScanFailureKind kind, String message, Throwable cause) {
        super(kind.code() + ": " + (message == null ? "" : message), cause);
        this.kind = kind;
    }

    public ScanFailureKind getKind() {
        return kind;
    }
}
