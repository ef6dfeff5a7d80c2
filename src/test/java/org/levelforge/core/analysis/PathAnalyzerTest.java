package org.levelforge.core.analysis;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.TileGrid;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PathAnalyzerTest {

    private final PathAnalyzer analyzer = new PathAnalyzer();

    static GeneratedLevel level(TileGrid grid, List<GridPoint> spawns, List<GridPoint> goals) {
        return new GeneratedLevel(grid, spawns, goals, Map.of(), Map.of());
    }

    @Test
    void straightCorridor_isWalkedTileByTile() {
        GeneratedLevel level = level(TileGrid.parse(
                "#######",
                "#.....#",
                "#######"), List.of(), List.of());

        Optional<List<GridPoint>> path = analyzer.findPath(level, new GridPoint(1, 1), new GridPoint(5, 1));

        assertThat(path).isPresent();
        assertThat(path.get()).containsExactly(
                new GridPoint(1, 1), new GridPoint(2, 1), new GridPoint(3, 1), new GridPoint(4, 1), new GridPoint(5, 1));
    }

    @Test
    void openRoom_usesDiagonals() {
        GeneratedLevel level = level(TileGrid.parse(
                "......",
                "......",
                "......",
                "......"), List.of(), List.of());

        List<GridPoint> path = analyzer.findPath(level, new GridPoint(0, 0), new GridPoint(3, 3)).orElseThrow();

        // optimal cost 3*sqrt(2) takes 3 diagonal steps
        assertThat(path).hasSize(4);
        assertThat(path.get(0)).isEqualTo(new GridPoint(0, 0));
        assertThat(path.get(3)).isEqualTo(new GridPoint(3, 3));
        assertStepsAreAdjacentAndWalkable(level, path);
    }

    @Test
    void detour_aroundAWall() {
        GeneratedLevel level = level(TileGrid.parse(
                ".#...",
                ".#.#.",
                "...#."), List.of(), List.of());

        List<GridPoint> path = analyzer.findPath(level, new GridPoint(0, 0), new GridPoint(4, 0)).orElseThrow();

        assertStepsAreAdjacentAndWalkable(level, path);
        assertThat(path.get(0)).isEqualTo(new GridPoint(0, 0));
        assertThat(path.get(path.size() - 1)).isEqualTo(new GridPoint(4, 0));
    }

    @Test
    void search_leavesTheGridAsItWas() {
        TileGrid grid = TileGrid.parse(
                "#######",
                "#..#..#",
                "#.....#",
                "#######");
        GeneratedLevel level = level(grid, List.of(new GridPoint(1, 1)), List.of(new GridPoint(5, 1)));

        analyzer.findPlayerPaths(level);

        assertThat(level.tiles().sameTiles(grid)).isTrue();
    }

    @Test
    void unreachableGoal_isEmpty() {
        GeneratedLevel level = level(TileGrid.parse(
                "..#..",
                "..#..",
                "..#.."), List.of(), List.of());

        assertThat(analyzer.findPath(level, new GridPoint(0, 0), new GridPoint(4, 2))).isEmpty();
    }

    @Test
    void outOfBoundsEndpoint_isEmpty_sameEndpoints_isSinglePoint() {
        GeneratedLevel level = level(TileGrid.parse("..."), List.of(), List.of());

        assertThat(analyzer.findPath(level, new GridPoint(0, 0), new GridPoint(9, 0))).isEmpty();
        assertThat(analyzer.findPath(level, new GridPoint(1, 0), new GridPoint(1, 0)))
                .contains(List.of(new GridPoint(1, 0)));
    }

    @Test
    void findPlayerPaths_skipsDisconnectedPairs() {
        GeneratedLevel level = level(TileGrid.parse(
                "..#..",
                "..#.."),
                List.of(new GridPoint(0, 0), new GridPoint(4, 0)),
                List.of(new GridPoint(1, 1)));

        List<List<GridPoint>> paths = analyzer.findPlayerPaths(level);

        assertThat(paths).hasSize(1);
        assertThat(paths.get(0).get(0)).isEqualTo(new GridPoint(0, 0));
    }

    static void assertStepsAreAdjacentAndWalkable(GeneratedLevel level, List<GridPoint> path) {
        for (int i = 0; i < path.size(); i++) {
            GridPoint p = path.get(i);
            assertThat(level.isWalkable(p.x(), p.y())).as("walkable %s", p).isTrue();
            if (i > 0) {
                GridPoint prev = path.get(i - 1);
                assertThat(Math.abs(p.x() - prev.x())).isLessThanOrEqualTo(1);
                assertThat(Math.abs(p.y() - prev.y())).isLessThanOrEqualTo(1);
            }
        }
    }
}
