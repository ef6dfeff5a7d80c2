package org.levelforge.core.analysis;

/**
 * Dense per-tile scalar field indexed [y][x], kept apart from the tile grid so analyses
 * can be recomputed without touching level state.
 */
public class ScalarField {

    private final int width;
    private final int height;
    private final double[][] values;

    public ScalarField(int width, int height) {
        this.width = width;
        this.height = height;
        this.values = new double[height][width];
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public double get(int x, int y) {
        return values[y][x];
    }

    public void set(int x, int y, double v) {
        values[y][x] = v;
    }

    public void add(int x, int y, double v) {
        values[y][x] += v;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (double[] row : values) {
            for (double v : row) m = Math.max(m, v);
        }
        return m;
    }

    public boolean isAllZero() {
        for (double[] row : values) {
            for (double v : row) {
                if (v != 0.0) return false;
            }
        }
        return true;
    }

    /**
     * Copy divided by its own maximum. A field whose maximum is not positive comes back
     * unchanged (an all-zero field stays zero).
     */
    public ScalarField normalized() {
        ScalarField out = new ScalarField(width, height);
        double m = max();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                out.values[y][x] = m > 0.0 ? values[y][x] / m : values[y][x];
            }
        }
        return out;
    }
}
