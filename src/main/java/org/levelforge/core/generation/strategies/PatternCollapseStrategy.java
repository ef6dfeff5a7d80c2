package org.levelforge.core.generation.strategies;

import org.levelforge.core.generation.GenerationStrategy;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.List;
import java.util.Random;

import static org.levelforge.core.model.TileType.DOOR;
import static org.levelforge.core.model.TileType.FLOOR;
import static org.levelforge.core.model.TileType.WALL;

/**
 * Textured fill from a small library of 3x3 exemplar patterns.
 *
 * Every cell takes the center tile of a pattern drawn by weight. There is no constraint
 * propagation between neighbouring cells, so the output is a textured random fill; every
 * cell is always assigned.
 */
public class PatternCollapseStrategy implements GenerationStrategy {

    public record Pattern(String name, TileType[][] tiles, double weight) {
        public TileType center() {
            return tiles[tiles.length / 2][tiles[0].length / 2];
        }
    }

    public static final List<Pattern> DEFAULT_PATTERNS = List.of(
            new Pattern("open_floor", new TileType[][]{
                    {FLOOR, FLOOR, FLOOR},
                    {FLOOR, FLOOR, FLOOR},
                    {FLOOR, FLOOR, FLOOR}}, 1.0),
            new Pattern("wall_corner", new TileType[][]{
                    {WALL, WALL, FLOOR},
                    {WALL, WALL, FLOOR},
                    {FLOOR, FLOOR, FLOOR}}, 1.0),
            new Pattern("straight_wall", new TileType[][]{
                    {WALL, WALL, WALL},
                    {FLOOR, FLOOR, FLOOR},
                    {FLOOR, FLOOR, FLOOR}}, 1.0),
            new Pattern("doorway", new TileType[][]{
                    {WALL, DOOR, WALL},
                    {FLOOR, FLOOR, FLOOR},
                    {FLOOR, FLOOR, FLOOR}}, 1.0)
    );

    private final List<Pattern> patterns;
    private final double totalWeight;

    public PatternCollapseStrategy() {
        this(DEFAULT_PATTERNS);
    }

    public PatternCollapseStrategy(List<Pattern> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("Pattern library is empty");
        }
        double total = 0.0;
        for (Pattern p : patterns) total += Math.max(0.0, p.weight());
        if (total <= 0.0) {
            throw new IllegalArgumentException("Pattern weights sum to zero");
        }
        this.patterns = List.copyOf(patterns);
        this.totalWeight = total;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.PATTERN_COLLAPSE;
    }

    @Override
    public TileGrid generate(GenerationConfig config, Random rng) {
        TileGrid grid = new TileGrid(config.width, config.height, TileType.EMPTY);
        for (int y = 0; y < config.height; y++) {
            for (int x = 0; x < config.width; x++) {
                grid.set(x, y, pick(rng).center());
            }
        }
        return grid;
    }

    private Pattern pick(Random rng) {
        double r = rng.nextDouble() * totalWeight;
        for (Pattern p : patterns) {
            r -= Math.max(0.0, p.weight());
            if (r < 0) return p;
        }
        return patterns.get(patterns.size() - 1);
    }
}
