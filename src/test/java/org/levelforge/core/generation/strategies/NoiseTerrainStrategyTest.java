package org.levelforge.core.generation.strategies;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class NoiseTerrainStrategyTest {

    private final NoiseTerrainStrategy strategy = new NoiseTerrainStrategy();

    @Test
    void classify_thresholds() {
        assertThat(NoiseTerrainStrategy.classify(-0.5)).isEqualTo(TileType.WATER);
        assertThat(NoiseTerrainStrategy.classify(-0.3)).isEqualTo(TileType.FLOOR);
        assertThat(NoiseTerrainStrategy.classify(-0.01)).isEqualTo(TileType.FLOOR);
        assertThat(NoiseTerrainStrategy.classify(0.0)).isEqualTo(TileType.OBSTACLE);
        assertThat(NoiseTerrainStrategy.classify(0.29)).isEqualTo(TileType.OBSTACLE);
        assertThat(NoiseTerrainStrategy.classify(0.3)).isEqualTo(TileType.WALL);
    }

    @Test
    void sameSeed_sameTerrain() {
        GenerationConfig config = GenerationConfig.builder(40, 30, Algorithm.NOISE).build();

        TileGrid a = strategy.generate(config, new Random(8L));
        TileGrid b = strategy.generate(config, new Random(8L));

        assertThat(a.sameTiles(b)).isTrue();
        assertThat(a.width()).isEqualTo(40);
        assertThat(a.height()).isEqualTo(30);
    }

    @Test
    void onlyTerrainTileTypes() {
        TileGrid grid = strategy.generate(GenerationConfig.builder(30, 30, Algorithm.NOISE).build(), new Random(1L));
        Set<TileType> allowed = EnumSet.of(TileType.WATER, TileType.FLOOR, TileType.OBSTACLE, TileType.WALL);

        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                assertThat(allowed).contains(grid.get(x, y));
            }
        }
    }

    @Test
    void perlinNoise_isZeroOnLatticePoints() {
        PerlinNoise noise = new PerlinNoise(new Random(3L));

        assertThat(noise.noise(0, 0)).isCloseTo(0.0, within(1e-12));
        assertThat(noise.noise(5, -7)).isCloseTo(0.0, within(1e-12));
        assertThat(noise.noise(0.5, 0.5)).isEqualTo(new PerlinNoise(new Random(3L)).noise(0.5, 0.5));
    }
}
