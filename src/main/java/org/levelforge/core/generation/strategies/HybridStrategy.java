package org.levelforge.core.generation.strategies;

import org.levelforge.core.generation.GenerationStrategy;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Cave base, rectangular rooms joined by L-shaped corridors, then a coarse noise pass
 * that drops obstacles onto open floor. The outer ring stays wall.
 */
public class HybridStrategy implements GenerationStrategy {

    static final int MIN_ROOM_SIZE = 4;
    static final int PLACEMENT_ATTEMPTS_PER_ROOM = 20;
    static final double DETAIL_NOISE_SCALE = 0.2;
    static final int DETAIL_NOISE_OCTAVES = 2;

    public record Room(int x, int y, int w, int h) {
        public int centerX() {
            return x + w / 2;
        }

        public int centerY() {
            return y + h / 2;
        }

        /** Overlap test with a one-tile margin so rooms never merge edge to edge. */
        public boolean overlaps(Room o) {
            return x - 1 < o.x + o.w && o.x - 1 < x + w
                    && y - 1 < o.y + o.h && o.y - 1 < y + h;
        }
    }

    private final CellularAutomatonStrategy cellular = new CellularAutomatonStrategy();
    private final NoiseTerrainStrategy noise = new NoiseTerrainStrategy();

    @Override
    public Algorithm algorithm() {
        return Algorithm.HYBRID;
    }

    @Override
    public TileGrid generate(GenerationConfig config, Random rng) {
        int width = config.width;
        int height = config.height;

        TileGrid level = cellular.generate(width, height, config.wallProbability, config.iterations, rng);

        List<Room> rooms = placeRooms(width, height, config.roomCount, rng);
        for (Room room : rooms) {
            carveRect(level, room.x, room.y, room.x + room.w - 1, room.y + room.h - 1);
        }
        for (int i = 0; i < rooms.size() - 1; i++) {
            connectRooms(level, rooms.get(i), rooms.get(i + 1), config.corridorWidth, rng);
        }

        TileGrid detail = noise.generate(width, height, DETAIL_NOISE_SCALE, DETAIL_NOISE_OCTAVES,
                config.persistence, config.lacunarity, rng);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (level.get(x, y) == TileType.FLOOR && detail.get(x, y) == TileType.OBSTACLE) {
                    level.set(x, y, TileType.OBSTACLE);
                }
            }
        }
        return level;
    }

    /**
     * Up to {@code roomCount} non-overlapping rooms inside the border ring. Sizes scale with
     * the grid (4 .. dim/4). Placement gives up on a room after a bounded number of tries,
     * so crowded grids get fewer rooms.
     */
    List<Room> placeRooms(int width, int height, int roomCount, Random rng) {
        List<Room> rooms = new ArrayList<>();
        int maxW = Math.max(MIN_ROOM_SIZE, width / 4);
        int maxH = Math.max(MIN_ROOM_SIZE, height / 4);
        // interior is [1, dim-2]
        if (width - 2 < MIN_ROOM_SIZE || height - 2 < MIN_ROOM_SIZE) {
            return rooms;
        }

        for (int r = 0; r < roomCount; r++) {
            for (int attempt = 0; attempt < PLACEMENT_ATTEMPTS_PER_ROOM; attempt++) {
                int w = MIN_ROOM_SIZE + rng.nextInt(Math.min(maxW, width - 2) - MIN_ROOM_SIZE + 1);
                int h = MIN_ROOM_SIZE + rng.nextInt(Math.min(maxH, height - 2) - MIN_ROOM_SIZE + 1);
                int x = 1 + rng.nextInt(width - 2 - w + 1);
                int y = 1 + rng.nextInt(height - 2 - h + 1);
                Room candidate = new Room(x, y, w, h);

                boolean free = true;
                for (Room other : rooms) {
                    if (candidate.overlaps(other)) {
                        free = false;
                        break;
                    }
                }
                if (free) {
                    rooms.add(candidate);
                    break;
                }
            }
        }
        return rooms;
    }

    private void connectRooms(TileGrid level, Room a, Room b, int corridorWidth, Random rng) {
        int x1 = a.centerX();
        int y1 = a.centerY();
        int x2 = b.centerX();
        int y2 = b.centerY();

        if (rng.nextBoolean()) {
            carveHorizontal(level, x1, x2, y1, corridorWidth);
            carveVertical(level, x2, y1, y2, corridorWidth);
        } else {
            carveVertical(level, x1, y1, y2, corridorWidth);
            carveHorizontal(level, x1, x2, y2, corridorWidth);
        }
    }

    private void carveHorizontal(TileGrid level, int x1, int x2, int y, int corridorWidth) {
        int half = corridorWidth / 2;
        carveRect(level, Math.min(x1, x2), y - half, Math.max(x1, x2), y - half + corridorWidth - 1);
    }

    private void carveVertical(TileGrid level, int x, int y1, int y2, int corridorWidth) {
        int half = corridorWidth / 2;
        carveRect(level, x - half, Math.min(y1, y2), x - half + corridorWidth - 1, Math.max(y1, y2));
    }

    // inclusive bounds, clipped to the interior so the border ring survives
    private void carveRect(TileGrid level, int x0, int y0, int x1, int y1) {
        int fromX = Math.max(1, x0);
        int toX = Math.min(level.width() - 2, x1);
        int fromY = Math.max(1, y0);
        int toY = Math.min(level.height() - 2, y1);
        for (int y = fromY; y <= toY; y++) {
            for (int x = fromX; x <= toX; x++) {
                level.set(x, y, TileType.FLOOR);
            }
        }
    }
}
