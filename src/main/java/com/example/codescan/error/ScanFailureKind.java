package com.example.codescan.error;

/**
 * Failure kinds reported by the scan core. {@link #code()} is stable and used in logs and
 * metric tags; {@link #recoverable()} tells whether a caller action can clear the failure.
 */
public enum ScanFailureKind {

    /** Capture device/input could not be acquired. Fatal until the caller retries start(). */
    SETUP_FAILED("setup-failed", true),

    /** Display size unknown (layout not performed) or the display layer cannot map yet. */
    GEOMETRY_UNAVAILABLE("geometry-unavailable", true),

    /** A caller hook raised an error. Caught at the boundary; session state is unaffected. */
    CALLBACK_FAILURE("callback-failure", false),

    /** start() without a configured region; scanning proceeds full-frame. */
    REGION_NOT_CONFIGURED("region-not-configured", true);

    private final String code;
    private final boolean recoverable;

    ScanFailureKind(String code, boolean recoverable) {
        this.code = code;
        this.recoverable = recoverable;
    }

    public String code() {
        return code;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
