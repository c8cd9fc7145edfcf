package com.example.codescan.geometry;

/**
 * Region of interest in the detector's coordinate space: origin top-left, every component
 * in {@code [0,1]}, axes independent of device rotation.
 */
public record NormalizedRect(double x, double y, double width, double height) {

    public static final NormalizedRect FULL_FRAME = new NormalizedRect(0d, 0d, 1d, 1d);

    // tolerance for float noise coming back from the display layer
    private static final double EPS = 1e-9;

    public NormalizedRect {
        requireUnit("x", x);
        requireUnit("y", y);
        requireUnit("width", width);
        requireUnit("height", height);
        if (x + width > 1d + EPS || y + height > 1d + EPS) {
            throw new IllegalArgumentException("rect exceeds unit frame: " + x + "," + y + "," + width + "," + height);
        }
    }

    /**
     * Derives an in-range rect from raw values: origin clamped into [0,1], extent cut at the frame edge.
     * Non-finite inputs collapse to 0.
     */
    public static NormalizedRect clamped(double x, double y, double width, double height) {
        double x0 = clampUnit(x);
        double y0 = clampUnit(y);
        double x1 = clampUnit(x + width);
        double y1 = clampUnit(y + height);
        return new NormalizedRect(x0, y0, Math.max(0d, x1 - x0), Math.max(0d, y1 - y0));
    }

    public boolean isFullFrame() {
        return equals(FULL_FRAME);
    }

    public boolean isEmpty() {
        return width <= 0d || height <= 0d;
    }

    public boolean contains(NormalizedRect other) {
        return other != null
                && other.x >= x - EPS && other.y >= y - EPS
                && other.x + other.width <= x + width + EPS
                && other.y + other.height <= y + height + EPS;
    }

    private static void requireUnit(String name, double v) {
        if (!Double.isFinite(v) || v < 0d || v > 1d + EPS) {
            throw new IllegalArgumentException(name + " must be within [0,1]: " + v);
        }
    }

    private static double clampUnit(double v) {
        if (!Double.isFinite(v)) return 0d;
        return Math.max(0d, Math.min(1d, v));
    }
}
