package org.levelforge.core.generation.strategies;

import org.levelforge.core.generation.GenerationStrategy;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.Random;

/**
 * Cave-like levels: random wall seeding smoothed by the 4-5 rule.
 */
public class CellularAutomatonStrategy implements GenerationStrategy {

    @Override
    public Algorithm algorithm() {
        return Algorithm.CELLULAR;
    }

    @Override
    public TileGrid generate(GenerationConfig config, Random rng) {
        return generate(config.width, config.height, config.wallProbability, config.iterations, rng);
    }

    public TileGrid generate(int width, int height, double wallProbability, int iterations, Random rng) {
        TileGrid grid = new TileGrid(width, height, TileType.FLOOR);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                grid.set(x, y, rng.nextDouble() < wallProbability ? TileType.WALL : TileType.FLOOR);
            }
        }

        for (int i = 0; i < iterations; i++) {
            grid = smoothStep(grid);
        }

        grid.fillBorder(TileType.WALL);
        return grid;
    }

    // double buffer: every cell reads the previous generation
    private TileGrid smoothStep(TileGrid src) {
        TileGrid next = src.copy();
        for (int y = 1; y < src.height() - 1; y++) {
            for (int x = 1; x < src.width() - 1; x++) {
                int walls = countWallNeighbours(src, x, y);
                if (walls >= 5) {
                    next.set(x, y, TileType.WALL);
                } else if (walls <= 3) {
                    next.set(x, y, TileType.FLOOR);
                }
            }
        }
        return next;
    }

    static int countWallNeighbours(TileGrid grid, int cx, int cy) {
        int count = 0;
        for (int y = cy - 1; y <= cy + 1; y++) {
            for (int x = cx - 1; x <= cx + 1; x++) {
                if (x == cx && y == cy) continue;
                if (grid.inBounds(x, y) && grid.get(x, y) == TileType.WALL) {
                    count++;
                }
            }
        }
        return count;
    }
}
