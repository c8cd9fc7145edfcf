package com.example.codescan.error;

/**
 * Display geometry is not known yet (layout not performed) or the display layer
 * could not produce a frame mapping. Retry after the next layout pass.
 */
public class GeometryUnavailableException extends ScanException {

    public GeometryUnavailableException(String message) {
        super(ScanFailureKind.GEOMETRY_UNAVAILABLE, message);
    }
}
