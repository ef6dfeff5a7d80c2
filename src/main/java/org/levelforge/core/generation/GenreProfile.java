package org.levelforge.core.generation;

import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.TileType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-genre tables: generation parameter overrides, special tiles scattered after
 * generation, and object count multipliers used by placement.
 */
public record GenreProfile(String name,
                           List<String> aliases,
                           Map<String, Number> generationOverrides,
                           List<TileType> specialTiles,
                           Map<ObjectType, Double> objectMultipliers) {

    public static final GenreProfile NEUTRAL =
            new GenreProfile("", List.of(), Map.of(), List.of(), Map.of());

    public GenreProfile {
        aliases = List.copyOf(aliases);
        generationOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(generationOverrides));
        specialTiles = List.copyOf(specialTiles);
        objectMultipliers = objectMultipliers.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(objectMultipliers));
    }

    public double multiplierFor(ObjectType type) {
        return objectMultipliers.getOrDefault(type, 1.0);
    }

    public boolean isNeutral() {
        return name.isEmpty();
    }
}
