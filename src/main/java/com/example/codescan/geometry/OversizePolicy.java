package com.example.codescan.geometry;

/** What {@link RegionMapper} does with a scan box larger than the display. */
public enum OversizePolicy {

    /** Shrink the box to fit the display. A square stays square (side = min of the sides). */
    CLAMP,

    /** Keep the requested size; the rect extends past the display edges. */
    OVERFLOW
}
