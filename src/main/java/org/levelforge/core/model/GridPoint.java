package org.levelforge.core.model;

/**
 * Integer tile coordinate; x is the column, y the row.
 */
public record GridPoint(int x, int y) {

    public double distanceTo(GridPoint other) {
        return distance(x, y, other.x, other.y);
    }

    public static double distance(int x1, int y1, int x2, int y2) {
        double dx = x1 - x2;
        double dy = y1 - y2;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
