package org.levelforge.core.service;

import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;

import java.util.List;

public record LevelBundle(GeneratedLevel level, List<GameObject> objects) {

    public LevelBundle {
        objects = List.copyOf(objects);
    }
}
