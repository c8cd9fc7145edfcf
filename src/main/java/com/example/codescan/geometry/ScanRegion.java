package com.example.codescan.geometry;

/**
 * Scan box size in display points. The center is implicitly the display's center.
 */
public record ScanRegion(int widthPx, int heightPx) {

    public static final int DEFAULT_SIZE = 200;

    public ScanRegion {
        if (widthPx <= 0 || heightPx <= 0) {
            throw new IllegalArgumentException("scan region must be positive: " + widthPx + "x" + heightPx);
        }
    }

    public static ScanRegion square(int side) {
        return new ScanRegion(side, side);
    }

    public boolean isSquare() {
        return widthPx == heightPx;
    }
}
