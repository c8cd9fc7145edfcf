package com.example.codescan.session;

/**
 * Interface orientation as reported by the host on rotation events.
 */
public enum OrientationState {
    PORTRAIT,
    PORTRAIT_UPSIDE_DOWN,
    LANDSCAPE_LEFT,
    LANDSCAPE_RIGHT;

    /** Unknown orientation maps to {@link #PORTRAIT}. */
    public static OrientationState orDefault(OrientationState o) {
        return (o == null) ? PORTRAIT : o;
    }
}
