package org.levelforge.core.analysis;

import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;

import java.util.List;

/**
 * Challenge estimate per walkable tile from three signals: distance from the spawn
 * points, choke points (few walkable neighbours) and proximity to a goal.
 */
public class DifficultyZoneAnalyzer implements FieldAnalyzer {

    /** spawn distance at which the distance term saturates */
    static final double SPAWN_DISTANCE_SATURATION = 10.0;
    static final int CHOKE_MAX_FREE_NEIGHBOURS = 3;
    static final double GOAL_RADIUS = 5.0;

    public ScalarField analyzeDifficultyZones(GeneratedLevel level, List<List<GridPoint>> paths) {
        int width = level.width();
        int height = level.height();
        ScalarField raw = new ScalarField(width, height);

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (!level.isWalkable(x, y)) continue;

                double v = 0.0;
                for (GridPoint spawn : level.spawnPoints()) {
                    double d = GridPoint.distance(x, y, spawn.x(), spawn.y());
                    v += Math.min(d / SPAWN_DISTANCE_SATURATION, 1.0);
                }

                v += chokeScore(level, x, y);

                for (GridPoint goal : level.goalPoints()) {
                    double d = GridPoint.distance(x, y, goal.x(), goal.y());
                    if (d <= GOAL_RADIUS) {
                        v += (GOAL_RADIUS - d) / GOAL_RADIUS;
                    }
                }
                raw.set(x, y, v);
            }
        }
        return raw.normalized();
    }

    @Override
    public ScalarField analyze(GeneratedLevel level, List<List<GridPoint>> paths) {
        return analyzeDifficultyZones(level, paths);
    }

    /**
     * (4 - free) / 4 when at most three of the eight neighbours are walkable, else 0.
     * Off-grid neighbours count as blocked.
     */
    static double chokeScore(GeneratedLevel level, int x, int y) {
        int free = 0;
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if (dx == 0 && dy == 0) continue;
                if (level.isWalkable(x + dx, y + dy)) free++;
            }
        }
        return free <= CHOKE_MAX_FREE_NEIGHBOURS ? (4 - free) / 4.0 : 0.0;
    }
}
