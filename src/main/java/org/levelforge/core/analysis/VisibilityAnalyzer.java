package org.levelforge.core.analysis;

import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.TileType;

import java.util.List;

/**
 * How often each tile falls inside a sightline from the analyzed paths. Rays are cast
 * from every second waypoint of the first few paths; walls and the grid edge stop them.
 * Low values are good hiding spots, high values prominent ones.
 */
public class VisibilityAnalyzer implements FieldAnalyzer {

    static final int MAX_PATHS = 3;
    static final int WAYPOINT_STRIDE = 2;
    static final int ANGLE_STEP_DEG = 5;
    static final int RADIUS = 7;

    private static final double[] RAY_DX = new double[360 / ANGLE_STEP_DEG];
    private static final double[] RAY_DY = new double[360 / ANGLE_STEP_DEG];

    static {
        for (int i = 0; i < RAY_DX.length; i++) {
            double rad = Math.toRadians(i * ANGLE_STEP_DEG);
            RAY_DX[i] = Math.cos(rad);
            RAY_DY[i] = Math.sin(rad);
        }
    }

    public ScalarField computeVisibilityMap(GeneratedLevel level, List<List<GridPoint>> paths) {
        ScalarField raw = new ScalarField(level.width(), level.height());
        int pathCount = Math.min(MAX_PATHS, paths.size());
        for (int p = 0; p < pathCount; p++) {
            List<GridPoint> path = paths.get(p);
            for (int i = 0; i < path.size(); i += WAYPOINT_STRIDE) {
                castRays(level, path.get(i), raw);
            }
        }
        return raw.normalized();
    }

    @Override
    public ScalarField analyze(GeneratedLevel level, List<List<GridPoint>> paths) {
        return computeVisibilityMap(level, paths);
    }

    static void castRays(GeneratedLevel level, GridPoint center, ScalarField acc) {
        for (int r = 0; r < RAY_DX.length; r++) {
            for (int step = 1; step <= RADIUS; step++) {
                // truncation toward zero, not floor
                int x = (int) (center.x() + RAY_DX[r] * step);
                int y = (int) (center.y() + RAY_DY[r] * step);

                if (!level.tiles().inBounds(x, y)) break;
                if (level.tileAt(x, y) == TileType.WALL) break;

                acc.add(x, y, 1.0);
            }
        }
    }
}
