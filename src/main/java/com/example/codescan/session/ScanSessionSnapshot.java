package com.example.codescan.session;

import com.example.codescan.geometry.DisplaySize;
import com.example.codescan.geometry.NormalizedRect;
import com.example.codescan.geometry.ScanRegion;

/**
 * Point-in-time view of a {@link ScanSession} for diagnostics.
 *
 * @param regionOfInterest null when no region was configured (full-frame scanning)
 * @param lastDetection    the detection that last halted the session; cleared on start()
 */
public record ScanSessionSnapshot(
        SessionState state,
        NormalizedRect regionOfInterest,
        ScanRegion scanRegion,
        OrientationState orientation,
        DisplaySize displaySize,
        DetectionEvent lastDetection,
        boolean setupFailed,
        long armCount
) {

    public boolean regionConfigured() {
        return regionOfInterest != null;
    }
}
