package org.levelforge.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Spatial constraints for one object type. Immutable; use {@link Builder} to derive
 * variants.
 */
public class PlacementRule {

    public final ObjectType objectType;
    public final double minDistanceFromWalls;
    public final double minDistanceFromSameType;
    public final double maxDistanceFromSameType;
    public final Set<TileType> preferredTiles;
    public final Set<TileType> forbiddenTiles;
    /** objects per walkable tile */
    public final double densityPerArea;
    /** 0 = avoid clusters, 1 = prefer clusters */
    public final double clusteringPreference;
    public final double strategicImportance;

    private PlacementRule(Builder b) {
        this.objectType = b.objectType;
        this.minDistanceFromWalls = b.minDistanceFromWalls;
        this.minDistanceFromSameType = b.minDistanceFromSameType;
        this.maxDistanceFromSameType = b.maxDistanceFromSameType;
        this.preferredTiles = Collections.unmodifiableSet(copyOf(b.preferredTiles));
        this.forbiddenTiles = Collections.unmodifiableSet(copyOf(b.forbiddenTiles));
        this.densityPerArea = b.densityPerArea;
        this.clusteringPreference = b.clusteringPreference;
        this.strategicImportance = b.strategicImportance;
    }

    public static PlacementRule defaultsFor(ObjectType type) {
        return new Builder(type).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(objectType);
        b.minDistanceFromWalls = minDistanceFromWalls;
        b.minDistanceFromSameType = minDistanceFromSameType;
        b.maxDistanceFromSameType = maxDistanceFromSameType;
        b.preferredTiles = copyOf(preferredTiles);
        b.forbiddenTiles = copyOf(forbiddenTiles);
        b.densityPerArea = densityPerArea;
        b.clusteringPreference = clusteringPreference;
        b.strategicImportance = strategicImportance;
        return b;
    }

    /** Tile-type part of the rule: preferred (when set) and not forbidden. */
    public boolean allowsTile(TileType type) {
        if (forbiddenTiles.contains(type)) return false;
        return preferredTiles.isEmpty() || preferredTiles.contains(type);
    }

    private static EnumSet<TileType> copyOf(Set<TileType> src) {
        return (src == null || src.isEmpty()) ? EnumSet.noneOf(TileType.class) : EnumSet.copyOf(src);
    }

    @Override
    public String toString() {
        return "PlacementRule{" + objectType
                + " wall>=" + minDistanceFromWalls
                + " same>=" + minDistanceFromSameType
                + " density=" + densityPerArea
                + " cluster=" + clusteringPreference
                + " importance=" + strategicImportance + "}";
    }

    public static class Builder {
        public final ObjectType objectType;
        public double minDistanceFromWalls = 1.0;
        public double minDistanceFromSameType = 3.0;
        public double maxDistanceFromSameType = 10.0;
        public Set<TileType> preferredTiles = EnumSet.of(TileType.FLOOR);
        public Set<TileType> forbiddenTiles = EnumSet.of(TileType.WALL, TileType.WATER);
        public double densityPerArea = 0.1;
        public double clusteringPreference = 0.5;
        public double strategicImportance = 1.0;

        public Builder(ObjectType objectType) {
            this.objectType = objectType;
        }

        public PlacementRule build() {
            if (objectType == null) {
                throw new IllegalArgumentException("PlacementRule needs an object type");
            }
            if (clusteringPreference < 0.0 || clusteringPreference > 1.0) {
                throw new IllegalArgumentException("clusteringPreference out of [0,1]: " + clusteringPreference);
            }
            if (maxDistanceFromSameType <= 0.0) {
                throw new IllegalArgumentException("maxDistanceFromSameType must be positive: " + maxDistanceFromSameType);
            }
            return new PlacementRule(this);
        }
    }
}
