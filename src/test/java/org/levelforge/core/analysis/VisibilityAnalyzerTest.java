package org.levelforge.core.analysis;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.TileGrid;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class VisibilityAnalyzerTest {

    private final VisibilityAnalyzer analyzer = new VisibilityAnalyzer();

    @Test
    void wallsStopRays() {
        TileGrid grid = TileGrid.parse(
                "#########",
                "#...#...#",
                "#########");
        GeneratedLevel level = PathAnalyzerTest.level(grid, List.of(), List.of());

        ScalarField field = analyzer.computeVisibilityMap(level, List.of(List.of(new GridPoint(1, 1))));

        assertThat(field.get(2, 1)).isGreaterThan(0.0);
        assertThat(field.get(3, 1)).isGreaterThan(0.0);
        assertThat(field.get(5, 1)).isZero();
        assertThat(field.get(6, 1)).isZero();
        assertThat(field.get(7, 1)).isZero();
        assertThat(field.get(4, 1)).isZero();
        assertThat(field.max()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void openArea_isNormalized() {
        TileGrid grid = TileGrid.parse(
                "............",
                "............",
                "............",
                "............",
                "............");
        GeneratedLevel level = PathAnalyzerTest.level(grid, List.of(), List.of());
        List<GridPoint> path = List.of(new GridPoint(0, 2), new GridPoint(1, 2), new GridPoint(2, 2),
                new GridPoint(3, 2), new GridPoint(4, 2));

        ScalarField field = analyzer.analyze(level, List.of(path));

        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                assertThat(field.get(x, y)).isBetween(0.0, 1.0);
            }
        }
        assertThat(field.max()).isCloseTo(1.0, within(1e-12));
        // beyond the ray radius from every sampled waypoint
        assertThat(field.get(11, 0)).isZero();
    }

    @Test
    void noPaths_allZero() {
        GeneratedLevel level = PathAnalyzerTest.level(TileGrid.parse("...."), List.of(), List.of());

        assertThat(analyzer.computeVisibilityMap(level, List.of()).isAllZero()).isTrue();
    }
}
