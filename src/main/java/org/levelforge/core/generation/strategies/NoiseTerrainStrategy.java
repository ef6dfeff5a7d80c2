package org.levelforge.core.generation.strategies;

import org.levelforge.core.generation.GenerationStrategy;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.Random;

/**
 * Open terrain from thresholded fractal noise: water, floor, obstacles, walls.
 */
public class NoiseTerrainStrategy implements GenerationStrategy {

    public static final double WATER_BELOW = -0.3;
    public static final double FLOOR_BELOW = 0.0;
    public static final double OBSTACLE_BELOW = 0.3;

    @Override
    public Algorithm algorithm() {
        return Algorithm.NOISE;
    }

    @Override
    public TileGrid generate(GenerationConfig config, Random rng) {
        return generate(config.width, config.height, config.noiseScale,
                config.octaves, config.persistence, config.lacunarity, rng);
    }

    public TileGrid generate(int width, int height,
                             double scale, int octaves, double persistence, double lacunarity,
                             Random rng) {
        PerlinNoise noise = new PerlinNoise(rng);
        TileGrid grid = new TileGrid(width, height, TileType.FLOOR);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double v = noise.fractal(x * scale, y * scale, octaves, persistence, lacunarity);
                grid.set(x, y, classify(v));
            }
        }
        return grid;
    }

    public static TileType classify(double v) {
        if (v < WATER_BELOW) return TileType.WATER;
        if (v < FLOOR_BELOW) return TileType.FLOOR;
        if (v < OBSTACLE_BELOW) return TileType.OBSTACLE;
        return TileType.WALL;
    }
}
