package com.example.codescan.session;

import com.example.codescan.error.ScanFailure;

/**
 * Caller hooks. Every method has a default, so implementers override only what they need.
 */
public interface ScanListener {

    ScanListener DEFAULTS = new ScanListener() {
    };

    /** Failure signal. Default: ignore. */
    default void onFailure(ScanFailure failure) {
    }

    /**
     * Result callback for a selected detection. Capture is already stopped when this runs.
     *
     * @return true to halt, false to resume scanning. Default: true (accept and halt)
     */
    default boolean onCapture(String content) {
        return true;
    }

    /**
     * Called right before the detector is armed. If arming then fails, no {@link #afterStop} follows;
     * the failure arrives through {@link #onFailure} as a setup failure instead.
     */
    default void beforeStart(ScanSession session) {
    }

    /** Called right after the detector is disarmed. */
    default void afterStop(ScanSession session) {
    }
}
