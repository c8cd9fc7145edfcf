package com.example.codescan.geometry;

/** Rectangle in display coordinates, origin top-left. */
public record DisplayRect(double x, double y, double width, double height) {

    public static DisplayRect centeredIn(DisplaySize display, double width, double height) {
        return new DisplayRect(display.centerX() - width / 2d, display.centerY() - height / 2d, width, height);
    }

    public double centerX() {
        return x + width / 2d;
    }

    public double centerY() {
        return y + height / 2d;
    }

    /** True when the rect lies within {@code (0,0)-(width,height)} of the display. */
    public boolean isContainedIn(DisplaySize display) {
        return x >= 0 && y >= 0 && x + width <= display.width() && y + height <= display.height();
    }
}
