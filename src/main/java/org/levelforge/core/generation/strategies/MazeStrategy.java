package org.levelforge.core.generation.strategies;

import org.levelforge.core.generation.GenerationStrategy;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Perfect maze by randomized depth-first backtracking.
 *
 * Odd coordinates are cells, even coordinates the walls between them, so both
 * dimensions are reduced to the nearest odd value. Carving uses an explicit stack;
 * the carved region is a spanning tree over all cells.
 */
public class MazeStrategy implements GenerationStrategy {

    private static final int[][] DIRECTIONS = {{0, 2}, {2, 0}, {0, -2}, {-2, 0}};

    @Override
    public Algorithm algorithm() {
        return Algorithm.MAZE;
    }

    @Override
    public TileGrid generate(GenerationConfig config, Random rng) {
        return generate(config.width, config.height, rng);
    }

    public TileGrid generate(int requestedWidth, int requestedHeight, Random rng) {
        int width = oddFloor(requestedWidth);
        int height = oddFloor(requestedHeight);
        TileGrid maze = new TileGrid(width, height, TileType.WALL);

        int startX = 1 + 2 * rng.nextInt((width - 1) / 2);
        int startY = 1 + 2 * rng.nextInt((height - 1) / 2);
        maze.set(startX, startY, TileType.FLOOR);

        // each frame: cell x, cell y, shuffled direction order, next direction index
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(frame(startX, startY, rng));

        while (!stack.isEmpty()) {
            int[] top = stack.peek();
            if (top[6] >= 4) {
                stack.pop();
                continue;
            }
            int[] dir = DIRECTIONS[top[2 + top[6]]];
            top[6]++;

            int nx = top[0] + dir[0];
            int ny = top[1] + dir[1];
            if (nx > 0 && nx < width - 1 && ny > 0 && ny < height - 1
                    && maze.get(nx, ny) == TileType.WALL) {
                maze.set(top[0] + dir[0] / 2, top[1] + dir[1] / 2, TileType.FLOOR);
                maze.set(nx, ny, TileType.FLOOR);
                stack.push(frame(nx, ny, rng));
            }
        }
        return maze;
    }

    private static int[] frame(int x, int y, Random rng) {
        int[] order = {0, 1, 2, 3};
        for (int i = order.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        return new int[]{x, y, order[0], order[1], order[2], order[3], 0};
    }

    public static int oddFloor(int v) {
        return (v % 2 == 0) ? v - 1 : v;
    }
}
