package com.example.codescan.session;

import com.example.codescan.geometry.FrameRectTransform;

/**
 * Video display side: owns the preview, the aspect-fill crop and the orientation-aware
 * display-to-frame mapping.
 */
public interface DisplayCollaborator extends FrameRectTransform {

    /** Applies a new output orientation before the next mapping request. No-op by default. */
    default void applyOrientation(OrientationState orientation) {
    }
}
