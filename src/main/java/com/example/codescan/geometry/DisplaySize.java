package com.example.codescan.geometry;

/**
 * Size of the display (superview) in display points.
 * A non-positive or non-finite dimension means layout has not been performed yet.
 */
public record DisplaySize(double width, double height) {

    public static final DisplaySize UNKNOWN = new DisplaySize(0, 0);

    public boolean isKnown() {
        return Double.isFinite(width) && Double.isFinite(height) && width > 0 && height > 0;
    }

    public double centerX() {
        return width / 2d;
    }

    public double centerY() {
        return height / 2d;
    }

    public double minSide() {
        return Math.min(width, height);
    }
}
