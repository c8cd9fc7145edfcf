package com.example.codescan.session;

/** Scan session lifecycle: IDLE → SCANNING → HALTED_ON_DETECTION → (SCANNING | IDLE). */
public enum SessionState {

    /** No capture active, no detections processed. */
    IDLE,

    /** Detector armed with the current region of interest; batches are processed. */
    SCANNING,

    /** Capture stopped right after a detection was selected; waiting on the result callback. */
    HALTED_ON_DETECTION;

    public boolean isActive() {
        return this == SCANNING;
    }
}
