package org.levelforge.core.generation.strategies;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PatternCollapseStrategyTest {

    @Test
    void everyCellIsAssignedFromAPatternCenter() {
        TileGrid grid = new PatternCollapseStrategy()
                .generate(GenerationConfig.builder(25, 15, Algorithm.PATTERN_COLLAPSE).build(), new Random(9L));

        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                assertThat(grid.get(x, y)).isIn(TileType.FLOOR, TileType.WALL);
            }
        }
        assertThat(grid.count(TileType.FLOOR)).isGreaterThan(0);
        assertThat(grid.count(TileType.WALL)).isGreaterThan(0);
    }

    @Test
    void singlePatternLibrary_fillsUniformly() {
        PatternCollapseStrategy.Pattern solid = new PatternCollapseStrategy.Pattern("solid", new TileType[][]{
                {TileType.WALL, TileType.WALL, TileType.WALL},
                {TileType.WALL, TileType.WALL, TileType.WALL},
                {TileType.WALL, TileType.WALL, TileType.WALL}}, 2.0);

        TileGrid grid = new PatternCollapseStrategy(List.of(solid))
                .generate(GenerationConfig.builder(6, 6, Algorithm.PATTERN_COLLAPSE).build(), new Random(1L));

        assertThat(grid.count(TileType.WALL)).isEqualTo(36);
    }

    @Test
    void emptyLibrary_isRejected() {
        assertThatThrownBy(() -> new PatternCollapseStrategy(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
