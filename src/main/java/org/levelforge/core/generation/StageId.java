package org.levelforge.core.generation;

public enum StageId {
    // level generation
    GENRE_MODIFIERS,
    BASE_GRID,
    POST_PROCESS,
    SPAWN_POINTS,
    GOAL_POINTS,
    SPECIAL_AREAS,
    METADATA,

    // object placement
    PATHS,
    DIFFICULTY,
    VISIBILITY,
    PLACEMENT
}
