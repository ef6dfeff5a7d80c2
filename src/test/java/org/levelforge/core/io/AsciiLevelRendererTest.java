package org.levelforge.core.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.PlacementRule;
import org.levelforge.core.model.TileGrid;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AsciiLevelRendererTest {

    @Test
    void rendersTilesWithObjectsOnTop() {
        GeneratedLevel level = new GeneratedLevel(TileGrid.parse(
                "#####",
                "#..~#",
                "#####"), List.of(), List.of(), Map.of(), Map.of());
        GameObject enemy = new GameObject("enemy_1", ObjectType.ENEMY, new GridPoint(2, 1), Map.of(),
                GameObject.DEFAULT_INFLUENCE_RADIUS, PlacementRule.defaultsFor(ObjectType.ENEMY));

        assertThat(AsciiLevelRenderer.render(level)).isEqualTo("#####\n#..~#\n#####");
        assertThat(AsciiLevelRenderer.render(level, List.of(enemy))).isEqualTo("#####\n#.E~#\n#####");
    }
}
