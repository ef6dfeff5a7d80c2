package org.levelforge.core.generation;

import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.TileType;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class LevelStats {

    public int width;
    public int height;
    public int tileCount;
    public int walkableCount;

    public String algorithm;
    public String genre;
    public Long seed;

    // tile type histogram, every type present (0 when absent)
    public final Map<TileType, Integer> tileCounts = new EnumMap<>(TileType.class);

    public int spawnCount;
    public int goalCount;
    public final Map<String, Integer> specialAreaCounts = new LinkedHashMap<>();

    // placed objects per type, only types that were placed
    public final Map<ObjectType, Integer> objectCounts = new EnumMap<>(ObjectType.class);
    public int objectTotal;

    public static LevelStats compute(GeneratedLevel level, List<GameObject> objects) {
        LevelStats s = new LevelStats();
        s.width = level.width();
        s.height = level.height();
        s.tileCount = s.width * s.height;

        for (TileType t : TileType.values()) {
            s.tileCounts.put(t, 0);
        }
        for (int y = 0; y < level.height(); y++) {
            for (int x = 0; x < level.width(); x++) {
                TileType t = level.tileAt(x, y);
                s.tileCounts.merge(t, 1, Integer::sum);
                if (t.isWalkable()) s.walkableCount++;
            }
        }

        Object alg = level.metadata().get(GeneratedLevel.META_ALGORITHM);
        s.algorithm = (alg == null) ? null : alg.toString();
        Object genre = level.metadata().get(GeneratedLevel.META_GENRE);
        s.genre = (genre == null) ? null : genre.toString();
        s.seed = level.seed();

        s.spawnCount = level.spawnPoints().size();
        s.goalCount = level.goalPoints().size();
        level.specialAreas().forEach((k, v) -> s.specialAreaCounts.put(k, v.size()));

        if (objects != null) {
            for (GameObject o : objects) {
                s.objectCounts.merge(o.type(), 1, Integer::sum);
            }
            s.objectTotal = objects.size();
        }
        return s;
    }
}
