package com.example.codescan.geometry;

/**
 * Display-to-frame transform owned by the video display layer, which alone knows the live
 * video dimensions, the orientation and the aspect-fill crop.
 */
@FunctionalInterface
public interface FrameRectTransform {

    /**
     * @return the region in detector-normalized coordinates, or null when the layer cannot map yet
     */
    NormalizedRect frameRectFor(DisplayRect displayRect);
}
