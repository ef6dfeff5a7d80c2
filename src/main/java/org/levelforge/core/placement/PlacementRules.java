package org.levelforge.core.placement;

import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.PlacementRule;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class PlacementRules {

    private PlacementRules() {}

    /** Default rule per object type. Types without a dedicated entry use the base rule. */
    public static Map<ObjectType, PlacementRule> defaults() {
        Map<ObjectType, PlacementRule> rules = new EnumMap<>(ObjectType.class);
        for (ObjectType t : ObjectType.values()) {
            rules.put(t, PlacementRule.defaultsFor(t));
        }

        PlacementRule.Builder enemy = new PlacementRule.Builder(ObjectType.ENEMY);
        enemy.minDistanceFromWalls = 1.5;
        enemy.minDistanceFromSameType = 4.0;
        enemy.densityPerArea = 0.05;
        enemy.clusteringPreference = 0.3;
        enemy.strategicImportance = 1.0;
        rules.put(ObjectType.ENEMY, enemy.build());

        PlacementRule.Builder item = new PlacementRule.Builder(ObjectType.ITEM);
        item.minDistanceFromWalls = 1.0;
        item.minDistanceFromSameType = 3.0;
        item.densityPerArea = 0.08;
        item.clusteringPreference = 0.1;
        item.strategicImportance = 0.7;
        rules.put(ObjectType.ITEM, item.build());

        PlacementRule.Builder trap = new PlacementRule.Builder(ObjectType.TRAP);
        trap.minDistanceFromWalls = 0.5;
        trap.minDistanceFromSameType = 5.0;
        trap.densityPerArea = 0.03;
        trap.clusteringPreference = 0.0;
        trap.strategicImportance = 0.9;
        rules.put(ObjectType.TRAP, trap.build());

        PlacementRule.Builder treasure = new PlacementRule.Builder(ObjectType.TREASURE);
        treasure.minDistanceFromWalls = 1.0;
        treasure.minDistanceFromSameType = 8.0;
        treasure.densityPerArea = 0.02;
        treasure.clusteringPreference = 0.0;
        treasure.strategicImportance = 1.0;
        rules.put(ObjectType.TREASURE, treasure.build());

        return Collections.unmodifiableMap(rules);
    }
}
