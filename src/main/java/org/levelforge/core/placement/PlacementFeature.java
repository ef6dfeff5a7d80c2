package org.levelforge.core.placement;

public enum PlacementFeature {
    DISTANCE_TO_PATH,
    DIFFICULTY,
    VISIBILITY,
    CLUSTERING,
    STRATEGIC
}
