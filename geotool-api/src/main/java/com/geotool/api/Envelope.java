package com.geotool.api;

/**
 * Axis-aligned bounding box in map units.
 */
public record Envelope(double minX, double minY, double maxX, double maxY) {

    private static final Envelope EMPTY = new Envelope(0, 0, -1, -1);

    public static Envelope empty() {
        return EMPTY;
    }

    /** True when the box has no area (inverted, degenerate or not a number). */
    public boolean isEmpty() {
        return !(maxX > minX && maxY > minY);
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }
}
