package org.levelforge.core.generation.strategies;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MazeStrategyTest {

    private final MazeStrategy maze = new MazeStrategy();

    @Test
    @DisplayName("20x20 request yields a 19x19 perfect maze with a wall border")
    void evenRequest_isReducedToOddPerfectMaze() {
        GenerationConfig.Builder b = GenerationConfig.builder(20, 20, Algorithm.MAZE);
        b.seed = 7L;
        TileGrid grid = maze.generate(b.build(), new Random(7L));

        assertThat(grid.width()).isEqualTo(19);
        assertThat(grid.height()).isEqualTo(19);
        assertBorderIsWall(grid);

        int floor = grid.count(TileType.FLOOR);
        assertThat(floor).isGreaterThan(0);
        assertThat(reachableFloor(grid)).isEqualTo(floor);
        // connected and |edges| = |cells| - 1 means a spanning tree: one path between any two cells
        assertThat(floorEdges(grid)).isEqualTo(floor - 1);
    }

    @Test
    void everyOddCellIsCarved() {
        TileGrid grid = maze.generate(15, 11, new Random(3L));

        for (int y = 1; y < grid.height(); y += 2) {
            for (int x = 1; x < grid.width(); x += 2) {
                assertThat(grid.get(x, y)).as("cell (%d,%d)", x, y).isEqualTo(TileType.FLOOR);
            }
        }
    }

    @Test
    void sameSeed_sameMaze() {
        TileGrid a = maze.generate(31, 21, new Random(11L));
        TileGrid b = maze.generate(31, 21, new Random(11L));

        assertThat(a.sameTiles(b)).isTrue();
    }

    @Test
    void largeMaze_doesNotOverflowTheStack() {
        TileGrid grid = maze.generate(401, 401, new Random(5L));

        assertThat(reachableFloor(grid)).isEqualTo(grid.count(TileType.FLOOR));
    }

    @Test
    void oddFloor() {
        assertThat(MazeStrategy.oddFloor(20)).isEqualTo(19);
        assertThat(MazeStrategy.oddFloor(21)).isEqualTo(21);
    }

    private static void assertBorderIsWall(TileGrid grid) {
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                if (grid.isBorder(x, y)) {
                    assertThat(grid.get(x, y)).as("border (%d,%d)", x, y).isEqualTo(TileType.WALL);
                }
            }
        }
    }

    private static int floorEdges(TileGrid grid) {
        int edges = 0;
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                if (grid.get(x, y) != TileType.FLOOR) continue;
                if (x + 1 < grid.width() && grid.get(x + 1, y) == TileType.FLOOR) edges++;
                if (y + 1 < grid.height() && grid.get(x, y + 1) == TileType.FLOOR) edges++;
            }
        }
        return edges;
    }

    private static int reachableFloor(TileGrid grid) {
        int w = grid.width();
        int h = grid.height();
        boolean[] seen = new boolean[w * h];
        Deque<int[]> queue = new ArrayDeque<>();
        outer:
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (grid.get(x, y) == TileType.FLOOR) {
                    queue.add(new int[]{x, y});
                    seen[y * w + x] = true;
                    break outer;
                }
            }
        }
        int count = 0;
        int[][] steps = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
        while (!queue.isEmpty()) {
            int[] c = queue.poll();
            count++;
            for (int[] s : steps) {
                int nx = c[0] + s[0];
                int ny = c[1] + s[1];
                if (!grid.inBounds(nx, ny) || seen[ny * w + nx]) continue;
                if (grid.get(nx, ny) != TileType.FLOOR) continue;
                seen[ny * w + nx] = true;
                queue.add(new int[]{nx, ny});
            }
        }
        return count;
    }
}
