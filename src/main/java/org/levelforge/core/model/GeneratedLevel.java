package org.levelforge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one level generation. Read-only once built: placement and external
 * serializers consume it as is. The constructor keeps a read-only copy of the grid.
 */
public class GeneratedLevel {

    public static final String META_ALGORITHM = "algorithm";
    public static final String META_GENRE = "genre";
    public static final String META_SEED = "seed";
    public static final String META_PARAMETERS = "parameters";

    private final TileGrid tiles;
    private final List<GridPoint> spawnPoints;
    private final List<GridPoint> goalPoints;
    private final Map<String, List<GridPoint>> specialAreas;
    private final Map<String, Object> metadata;

    public GeneratedLevel(TileGrid tiles,
                          List<GridPoint> spawnPoints,
                          List<GridPoint> goalPoints,
                          Map<String, List<GridPoint>> specialAreas,
                          Map<String, Object> metadata) {
        this.tiles = tiles.readOnly();
        this.spawnPoints = List.copyOf(spawnPoints);
        this.goalPoints = List.copyOf(goalPoints);

        Map<String, List<GridPoint>> areas = new LinkedHashMap<>();
        specialAreas.forEach((k, v) -> areas.put(k, List.copyOf(v)));
        this.specialAreas = Collections.unmodifiableMap(areas);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public TileGrid tiles() {
        return tiles;
    }

    public int width() {
        return tiles.width();
    }

    public int height() {
        return tiles.height();
    }

    public TileType tileAt(int x, int y) {
        return tiles.get(x, y);
    }

    public boolean isWalkable(int x, int y) {
        return tiles.isWalkable(x, y);
    }

    public List<GridPoint> spawnPoints() {
        return spawnPoints;
    }

    public List<GridPoint> goalPoints() {
        return goalPoints;
    }

    public Map<String, List<GridPoint>> specialAreas() {
        return specialAreas;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /** Effective seed from metadata, or null when the level was built without one. */
    public Long seed() {
        Object v = metadata.get(META_SEED);
        return (v instanceof Number n) ? n.longValue() : null;
    }

    /** Every coordinate the level lists (spawn, goal and special areas). */
    public List<GridPoint> allListedPoints() {
        List<GridPoint> out = new ArrayList<>(spawnPoints);
        out.addAll(goalPoints);
        specialAreas.values().forEach(out::addAll);
        return out;
    }
}
