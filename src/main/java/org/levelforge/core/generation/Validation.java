package org.levelforge.core.generation;

import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;
import org.levelforge.core.generation.strategies.MazeStrategy;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class Validation {

    private Validation() {}

    public static void afterBaseGrid(TileGrid grid, GenerationConfig config) {
        if (grid == null) {
            throw new IllegalStateException("Strategy " + config.algorithm.tag() + " returned no grid");
        }
        int wantW = config.algorithm == Algorithm.MAZE ? MazeStrategy.oddFloor(config.width) : config.width;
        int wantH = config.algorithm == Algorithm.MAZE ? MazeStrategy.oddFloor(config.height) : config.height;
        if (grid.width() != wantW || grid.height() != wantH) {
            throw new IllegalStateException("Grid size " + grid.width() + "x" + grid.height()
                    + " does not match requested " + wantW + "x" + wantH);
        }
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                if (grid.get(x, y) == null) {
                    throw new IllegalStateException("Unassigned tile at (" + x + "," + y + ")");
                }
            }
        }

        if (config.algorithm == Algorithm.CELLULAR || config.algorithm == Algorithm.HYBRID) {
            for (int y = 0; y < grid.height(); y++) {
                for (int x = 0; x < grid.width(); x++) {
                    if (grid.isBorder(x, y) && grid.get(x, y) != TileType.WALL) {
                        throw new IllegalStateException("Border tile (" + x + "," + y + ") is "
                                + grid.get(x, y) + " after " + config.algorithm.tag());
                    }
                }
            }
        }

        if (grid.count(TileType.FLOOR) == 0) {
            // legal, but downstream falls back to fixed coordinates
            System.out.println("[WARN] No floor tiles after " + config.algorithm.tag() + " generation");
        }
    }

    public static void afterPoints(TileGrid grid, String what, List<GridPoint> points) {
        if (points.isEmpty()) {
            throw new IllegalStateException("No " + what + " points derived");
        }
        for (GridPoint p : points) {
            if (!grid.inBounds(p)) {
                throw new IllegalStateException(what + " point out of bounds: " + p
                        + " grid=" + grid.width() + "x" + grid.height());
            }
        }
    }

    public static void afterSpecialAreas(TileGrid grid, Map<String, List<GridPoint>> areas) {
        for (Map.Entry<String, List<GridPoint>> e : areas.entrySet()) {
            TileType want = TileType.valueOf(e.getKey().toUpperCase(Locale.ROOT));
            for (GridPoint p : e.getValue()) {
                if (!grid.inBounds(p) || grid.get(p) != want) {
                    throw new IllegalStateException("Special area '" + e.getKey() + "' lists " + p
                            + " which is not a " + want + " tile");
                }
            }
        }
    }

    public static void afterLevel(GeneratedLevel level) {
        for (GridPoint p : level.allListedPoints()) {
            if (!level.tiles().inBounds(p)) {
                throw new IllegalStateException("Level lists out-of-bounds coordinate " + p);
            }
        }
    }
}
