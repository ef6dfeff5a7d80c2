package org.levelforge.core.analysis;

import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * A* between every spawn/goal pair over 8-connected walkable tiles.
 *
 * Manhattan heuristic, orthogonal step 1, diagonal step sqrt(2). The open set pops the
 * lowest f-score; equal scores pop in insertion order. A tile whose cost improves is
 * queued again. Unconnected pairs contribute no path. The level is only read.
 */
public class PathAnalyzer {

    static final double DIAGONAL_COST = Math.sqrt(2.0);

    private static final int[][] STEPS = {
            {0, 1}, {1, 0}, {0, -1}, {-1, 0},
            {1, 1}, {-1, -1}, {1, -1}, {-1, 1}
    };

    private record OpenNode(int index, double g, double f, long order) {}

    /** One path per connected (spawn, goal) pair, spawn-major order. */
    public List<List<GridPoint>> findPlayerPaths(GeneratedLevel level) {
        List<List<GridPoint>> paths = new ArrayList<>();
        for (GridPoint spawn : level.spawnPoints()) {
            for (GridPoint goal : level.goalPoints()) {
                findPath(level, spawn, goal).ifPresent(paths::add);
            }
        }
        return paths;
    }

    public Optional<List<GridPoint>> findPath(GeneratedLevel level, GridPoint start, GridPoint goal) {
        int width = level.width();
        int height = level.height();
        if (!level.tiles().inBounds(start) || !level.tiles().inBounds(goal)) {
            return Optional.empty();
        }
        if (start.equals(goal)) {
            return Optional.of(List.of(start));
        }

        int n = width * height;
        double[] g = new double[n];
        int[] cameFrom = new int[n];
        Arrays.fill(g, Double.POSITIVE_INFINITY);
        Arrays.fill(cameFrom, -1);

        int startIdx = start.y() * width + start.x();
        int goalIdx = goal.y() * width + goal.x();

        PriorityQueue<OpenNode> open = new PriorityQueue<>((a, b) -> {
            int c = Double.compare(a.f, b.f);
            return c != 0 ? c : Long.compare(a.order, b.order);
        });
        long order = 0;
        g[startIdx] = 0.0;
        open.add(new OpenNode(startIdx, 0.0, heuristic(start.x(), start.y(), goal), order++));

        while (!open.isEmpty()) {
            OpenNode node = open.poll();
            int cur = node.index;
            // superseded by a cheaper entry for the same tile
            if (node.g > g[cur]) continue;
            if (cur == goalIdx) {
                return Optional.of(reconstruct(cameFrom, cur, width));
            }

            int cx = cur % width;
            int cy = cur / width;
            for (int[] step : STEPS) {
                int nx = cx + step[0];
                int ny = cy + step[1];
                if (!level.isWalkable(nx, ny)) continue;

                int next = ny * width + nx;

                double cost = (step[0] != 0 && step[1] != 0) ? DIAGONAL_COST : 1.0;
                double tentative = g[cur] + cost;
                if (tentative < g[next]) {
                    g[next] = tentative;
                    cameFrom[next] = cur;
                    open.add(new OpenNode(next, tentative, tentative + heuristic(nx, ny, goal), order++));
                }
            }
        }
        return Optional.empty();
    }

    private static double heuristic(int x, int y, GridPoint goal) {
        return Math.abs(x - goal.x()) + Math.abs(y - goal.y());
    }

    private static List<GridPoint> reconstruct(int[] cameFrom, int end, int width) {
        List<GridPoint> path = new ArrayList<>();
        for (int cur = end; cur != -1; cur = cameFrom[cur]) {
            path.add(new GridPoint(cur % width, cur / width));
        }
        Collections.reverse(path);
        return path;
    }
}
