package org.levelforge.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dense width x height tile array, indexed [y][x].
 *
 * Grids are filled by a generation strategy and then sealed with {@link #readOnly()}
 * before they are handed out. A sealed grid rejects writes; whoever needs to change it
 * works on {@link #copy()}, which is always writable.
 */
public class TileGrid {

    private final int width;
    private final int height;
    private final TileType[][] tiles;
    private boolean readOnly;

    public TileGrid(int width, int height, TileType fill) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.tiles = new TileType[height][width];
        for (TileType[] row : tiles) {
            Arrays.fill(row, fill);
        }
    }

    private TileGrid(TileGrid src) {
        this.width = src.width;
        this.height = src.height;
        this.tiles = new TileType[height][];
        for (int y = 0; y < height; y++) {
            this.tiles[y] = src.tiles[y].clone();
        }
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public TileType get(int x, int y) {
        return tiles[y][x];
    }

    public TileType get(GridPoint p) {
        return tiles[p.y()][p.x()];
    }

    public void set(int x, int y, TileType type) {
        checkWritable();
        tiles[y][x] = type;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public boolean inBounds(GridPoint p) {
        return inBounds(p.x(), p.y());
    }

    /** Out-of-bounds coordinates are never walkable. */
    public boolean isWalkable(int x, int y) {
        return inBounds(x, y) && tiles[y][x].isWalkable();
    }

    public boolean isBorder(int x, int y) {
        return x == 0 || y == 0 || x == width - 1 || y == height - 1;
    }

    public void fillBorder(TileType type) {
        checkWritable();
        for (int x = 0; x < width; x++) {
            tiles[0][x] = type;
            tiles[height - 1][x] = type;
        }
        for (int y = 0; y < height; y++) {
            tiles[y][0] = type;
            tiles[y][width - 1] = type;
        }
    }

    public int count(TileType type) {
        int n = 0;
        for (TileType[] row : tiles) {
            for (TileType t : row) {
                if (t == type) n++;
            }
        }
        return n;
    }

    public int countWalkable() {
        int n = 0;
        for (TileType[] row : tiles) {
            for (TileType t : row) {
                if (t.isWalkable()) n++;
            }
        }
        return n;
    }

    /** Positions of the given type in row-major order. */
    public List<GridPoint> positionsOf(TileType type) {
        List<GridPoint> out = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (tiles[y][x] == type) out.add(new GridPoint(x, y));
            }
        }
        return out;
    }

    public TileGrid copy() {
        return new TileGrid(this);
    }

    /** Read-only copy; this grid stays writable. */
    public TileGrid readOnly() {
        if (readOnly) return this;
        TileGrid sealed = new TileGrid(this);
        sealed.readOnly = true;
        return sealed;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    private void checkWritable() {
        if (readOnly) {
            throw new UnsupportedOperationException("Grid " + width + "x" + height + " is read-only; work on copy()");
        }
    }

    public boolean sameTiles(TileGrid other) {
        return other != null
                && width == other.width
                && height == other.height
                && Arrays.deepEquals(tiles, other.tiles);
    }

    /** Tile codes as a [y][x] int matrix. */
    public int[][] toCodes() {
        int[][] out = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                out[y][x] = tiles[y][x].code();
            }
        }
        return out;
    }

    /**
     * Builds a grid from text rows, one glyph per tile (see {@link TileType#glyph()}).
     */
    public static TileGrid parse(String... rows) {
        int h = rows.length;
        int w = h == 0 ? 0 : rows[0].length();
        TileGrid grid = new TileGrid(w, h, TileType.EMPTY);
        for (int y = 0; y < h; y++) {
            if (rows[y].length() != w) {
                throw new IllegalArgumentException("Ragged row " + y + ": expected width " + w);
            }
            for (int x = 0; x < w; x++) {
                grid.tiles[y][x] = fromGlyph(rows[y].charAt(x));
            }
        }
        return grid;
    }

    private static TileType fromGlyph(char c) {
        for (TileType t : TileType.values()) {
            if (t.glyph() == c) return t;
        }
        throw new IllegalArgumentException("Unknown tile glyph: '" + c + "'");
    }
}
