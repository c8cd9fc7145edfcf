package com.example.codescan.session;

import com.example.codescan.geometry.NormalizedRect;

/**
 * Frame acquisition side. Implementations own the camera and the detector and deliver
 * {@link ScanSession#onDetectionBatch} once per processed frame while armed, and
 * {@link ScanSession#onSetupFailed} at most once at initialization.
 */
public interface CaptureCollaborator {

    /**
     * Start capture restricted to {@code roi}.
     *
     * @param roi region of interest, or null for the full frame
     */
    void armDetector(NormalizedRect roi);

    void disarmDetector();
}
