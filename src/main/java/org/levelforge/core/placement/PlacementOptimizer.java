package org.levelforge.core.placement;

import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.PlacementRule;
import org.levelforge.core.model.TileType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Greedy scored placement. Per object type: collect legal candidates, score each with
 * {@link FeatureWeights}, sort descending (ties keep row-major order) and accept
 * positions while they respect the same-type spacing.
 */
public class PlacementOptimizer {

    static final int WALL_SEARCH_RADIUS = 5;
    static final double NO_WALL_DISTANCE = 5.0;

    static final double PATH_OPTIMAL_DISTANCE = 3.0;
    static final double PATH_SCORE_WIDTH = 2.0;

    static final double GOAL_RANGE = 10.0;
    static final double SPAWN_RANGE = 5.0;

    private final FeatureWeights weights;
    private final ObjectPropertyGenerator properties;

    public PlacementOptimizer(FeatureWeights weights, ObjectPropertyGenerator properties) {
        this.weights = weights;
        this.properties = properties;
    }

    public PlacementOptimizer() {
        this(FeatureWeights.defaults(), new ObjectPropertyGenerator());
    }

    public FeatureWeights weights() {
        return weights;
    }

    /**
     * Places each requested type in enum order. Spacing is enforced between objects of the
     * same type only, so objects of different types may share a tile.
     */
    public List<GameObject> optimizePlacement(PlacementContext ctx,
                                              Map<ObjectType, Integer> counts,
                                              Map<ObjectType, PlacementRule> rules,
                                              Random rng) {
        List<GameObject> placed = new ArrayList<>();

        for (ObjectType type : ObjectType.values()) {
            Integer requested = counts.get(type);
            if (requested == null || requested <= 0) continue;

            PlacementRule rule = rules.get(type);
            if (rule == null) rule = PlacementRule.defaultsFor(type);

            List<GridPoint> positions = selectPositions(ctx, type, rule, requested, placed);
            if (positions.size() < requested) {
                System.out.println("[WARN] placement shortfall for " + type.tag()
                        + ": requested=" + requested + " placed=" + positions.size());
            }

            for (int i = 0; i < positions.size(); i++) {
                placed.add(new GameObject(
                        type.tag() + "_" + (i + 1),
                        type,
                        positions.get(i),
                        properties.generate(type, ctx.genre(), rng),
                        GameObject.DEFAULT_INFLUENCE_RADIUS,
                        rule));
            }
        }
        return placed;
    }

    List<GridPoint> selectPositions(PlacementContext ctx,
                                    ObjectType type,
                                    PlacementRule rule,
                                    int count,
                                    List<GameObject> existing) {
        List<GridPoint> candidates = candidatePositions(ctx.level, rule);
        if (candidates.isEmpty()) return List.of();

        List<ScoredPosition> scored = new ArrayList<>(candidates.size());
        for (GridPoint p : candidates) {
            scored.add(new ScoredPosition(p, score(ctx, p, type, rule, existing)));
        }
        // List.sort is stable: equal scores keep row-major order
        scored.sort(Comparator.comparingDouble(ScoredPosition::score).reversed());

        List<GridPoint> selected = new ArrayList<>();
        for (ScoredPosition sp : scored) {
            if (selected.size() >= count) break;
            boolean tooClose = false;
            for (GridPoint s : selected) {
                if (sp.position().distanceTo(s) < rule.minDistanceFromSameType) {
                    tooClose = true;
                    break;
                }
            }
            if (!tooClose) selected.add(sp.position());
        }
        return selected;
    }

    /** Row-major list of tiles satisfying walkability, the tile sets and wall clearance. */
    public List<GridPoint> candidatePositions(GeneratedLevel level, PlacementRule rule) {
        List<GridPoint> out = new ArrayList<>();
        for (int y = 0; y < level.height(); y++) {
            for (int x = 0; x < level.width(); x++) {
                TileType t = level.tileAt(x, y);
                if (!t.isWalkable()) continue;
                if (!rule.allowsTile(t)) continue;
                if (distanceToNearestWall(level, x, y) < rule.minDistanceFromWalls) continue;
                out.add(new GridPoint(x, y));
            }
        }
        return out;
    }

    public static double distanceToNearestWall(GeneratedLevel level, int x, int y) {
        double best = Double.POSITIVE_INFINITY;
        for (int dy = -WALL_SEARCH_RADIUS; dy <= WALL_SEARCH_RADIUS; dy++) {
            for (int dx = -WALL_SEARCH_RADIUS; dx <= WALL_SEARCH_RADIUS; dx++) {
                int nx = x + dx;
                int ny = y + dy;
                if (!level.tiles().inBounds(nx, ny)) continue;
                if (level.tileAt(nx, ny) != TileType.WALL) continue;
                best = Math.min(best, GridPoint.distance(x, y, nx, ny));
            }
        }
        return Double.isInfinite(best) ? NO_WALL_DISTANCE : best;
    }

    double score(PlacementContext ctx, GridPoint p, ObjectType type, PlacementRule rule, List<GameObject> existing) {
        Map<PlacementFeature, Double> f = new EnumMap<>(PlacementFeature.class);
        f.put(PlacementFeature.DISTANCE_TO_PATH, pathScore(ctx.playerPath, p));
        f.put(PlacementFeature.DIFFICULTY, difficultyScore(ctx, p, type));
        f.put(PlacementFeature.VISIBILITY, visibilityScore(ctx, p, type));
        f.put(PlacementFeature.CLUSTERING, clusteringScore(p, existing, rule));
        f.put(PlacementFeature.STRATEGIC, strategicScore(ctx.level, p, type) * rule.strategicImportance);
        return weights.score(f);
    }

    // ---------------------------------------------------------------------------------
    // features
    // ---------------------------------------------------------------------------------

    /** Peaks at 1 when the position is {@value #PATH_OPTIMAL_DISTANCE} tiles from the path. */
    public static double pathScore(List<GridPoint> path, GridPoint p) {
        if (path == null || path.isEmpty()) return 0.0;
        double d = minDistance(p, path);
        return 2.0 / (1.0 + Math.exp(Math.abs(d - PATH_OPTIMAL_DISTANCE) / PATH_SCORE_WIDTH));
    }

    public static double difficultyScore(PlacementContext ctx, GridPoint p, ObjectType type) {
        double d = ctx.difficulty.get(p.x(), p.y());
        return type == ObjectType.ENEMY ? d : 1.0 - d;
    }

    public static double visibilityScore(PlacementContext ctx, GridPoint p, ObjectType type) {
        double v = ctx.visibility.get(p.x(), p.y());
        return type == ObjectType.TRAP ? 1.0 - v : v;
    }

    public static double clusteringScore(GridPoint p, List<GameObject> existing, PlacementRule rule) {
        if (existing.isEmpty()) return 0.5;
        double sum = 0.0;
        for (GameObject o : existing) {
            sum += p.distanceTo(o.position());
        }
        double mean = sum / existing.size();
        double n = Math.min(mean / rule.maxDistanceFromSameType, 1.0);
        double pref = rule.clusteringPreference;
        return pref * (1.0 - n) + (1.0 - pref) * n;
    }

    /** Unscaled strategic value; the caller multiplies by the rule's importance. */
    public static double strategicScore(GeneratedLevel level, GridPoint p, ObjectType type) {
        return switch (type) {
            case ENEMY, TRAP -> goalProximity(level, p);
            case ITEM, CHECKPOINT -> spawnDistance(level, p);
            default -> 0.0;
        };
    }

    private static double goalProximity(GeneratedLevel level, GridPoint p) {
        if (level.goalPoints().isEmpty()) return 0.0;
        double goal = minDistance(p, level.goalPoints());
        return (GOAL_RANGE - Math.min(goal, GOAL_RANGE)) / GOAL_RANGE;
    }

    private static double spawnDistance(GeneratedLevel level, GridPoint p) {
        if (level.spawnPoints().isEmpty()) return 0.0;
        return Math.min(minDistance(p, level.spawnPoints()) / SPAWN_RANGE, 1.0);
    }

    private static double minDistance(GridPoint p, Collection<GridPoint> points) {
        double best = Double.POSITIVE_INFINITY;
        for (GridPoint q : points) {
            best = Math.min(best, p.distanceTo(q));
        }
        return best;
    }

    record ScoredPosition(GridPoint position, double score) {}
}
