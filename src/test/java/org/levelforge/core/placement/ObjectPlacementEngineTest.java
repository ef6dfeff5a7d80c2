package org.levelforge.core.placement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.generation.LevelGenerator;
import org.levelforge.core.generation.RecordingStageListener;
import org.levelforge.core.generation.StageId;
import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.PlacementRule;
import org.levelforge.core.model.ScenarioInput;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ObjectPlacementEngineTest {

    private final RecordingStageListener listener = new RecordingStageListener();
    private final ObjectPlacementEngine engine = new ObjectPlacementEngine(listener);

    private static GeneratedLevel openLevel(int w, int h) {
        TileGrid grid = new TileGrid(w, h, TileType.FLOOR);
        grid.fillBorder(TileType.WALL);
        return new GeneratedLevel(grid,
                List.of(new GridPoint(1, 1)),
                List.of(new GridPoint(w - 2, h - 2)),
                Map.of(), Map.of(GeneratedLevel.META_SEED, 3L));
    }

    @Test
    @DisplayName("Requesting 5 enemies where only 3 tiles qualify yields exactly 3")
    void shortfall_returnsOnlyCompliantPositions() {
        TileGrid grid = TileGrid.parse(
                "#################",
                "#...##...##...###",
                "#...##...##...###",
                "#...##...##...###",
                "#################");
        GeneratedLevel level = new GeneratedLevel(grid,
                List.of(new GridPoint(2, 2)), List.of(new GridPoint(12, 2)), Map.of(), Map.of());

        List<GameObject> enemies = engine.placeObjects(level, ScenarioInput.ofGenre(""),
                Map.of(ObjectType.ENEMY, 5), new Random(1L));

        assertThat(enemies).hasSize(3);
        assertThat(enemies).extracting(GameObject::position).containsExactlyInAnyOrder(
                new GridPoint(2, 2), new GridPoint(7, 2), new GridPoint(12, 2));
        assertThat(enemies).extracting(GameObject::type).containsOnly(ObjectType.ENEMY);
        assertMutuallySpaced(enemies);
    }

    @Test
    @DisplayName("Horror raises the trap count and lowers the enemy count")
    void horror_shiftsCountsPerMultiplierTable() {
        GeneratedLevel level = openLevel(40, 40);

        Map<ObjectType, Integer> baseline = engine.deriveObjectCounts(level, ScenarioInput.ofGenre(""));
        Map<ObjectType, Integer> horror = engine.deriveObjectCounts(level, ScenarioInput.ofGenre("horror"));

        assertThat(baseline).containsEntry(ObjectType.ENEMY, 72)
                .containsEntry(ObjectType.ITEM, 115)
                .containsEntry(ObjectType.TRAP, 43)
                .containsEntry(ObjectType.TREASURE, 28)
                .containsEntry(ObjectType.DECORATION, 144);
        assertThat(horror.get(ObjectType.TRAP)).isEqualTo(86).isGreaterThan(baseline.get(ObjectType.TRAP));
        assertThat(horror.get(ObjectType.ENEMY)).isEqualTo(57).isLessThan(baseline.get(ObjectType.ENEMY));
        assertThat(horror.get(ObjectType.ITEM)).isEqualTo(80);
        assertThat(horror.get(ObjectType.TREASURE)).isEqualTo(baseline.get(ObjectType.TREASURE));
        assertThat(engine.deriveObjectCounts(level, ScenarioInput.ofGenre("хоррор"))).isEqualTo(horror);
    }

    @Test
    void tinyLevel_getsMinimumCounts() {
        TileGrid grid = TileGrid.parse(
                "###",
                "#.#",
                "###");
        GeneratedLevel level = new GeneratedLevel(grid, List.of(new GridPoint(1, 1)), List.of(new GridPoint(1, 1)),
                Map.of(), Map.of());

        Map<ObjectType, Integer> counts = engine.deriveObjectCounts(level, ScenarioInput.ofGenre("horror"));

        assertThat(counts).containsEntry(ObjectType.ENEMY, 1)
                .containsEntry(ObjectType.ITEM, 1)
                .containsEntry(ObjectType.TRAP, 2)
                .containsEntry(ObjectType.TREASURE, 1)
                .containsEntry(ObjectType.DECORATION, 3)
                .doesNotContainKey(ObjectType.COVER);
    }

    @Test
    void generatedLevel_placementHonoursEveryRule() {
        GenerationConfig.Builder b = GenerationConfig.builder(36, 28, Algorithm.HYBRID);
        b.seed = 11L;
        GeneratedLevel level = new LevelGenerator(new RecordingStageListener())
                .generateLevel(ScenarioInput.ofGenre("cyberpunk"), b.build());

        List<GameObject> objects = engine.placeObjects(level, ScenarioInput.ofGenre("cyberpunk"), null);

        assertThat(objects).isNotEmpty();
        assertThat(objects).extracting(GameObject::id).doesNotHaveDuplicates();
        for (GameObject o : objects) {
            GridPoint p = o.position();
            PlacementRule rule = o.rule();
            assertThat(level.isWalkable(p.x(), p.y())).as("walkable %s", o).isTrue();
            assertThat(rule.allowsTile(level.tileAt(p.x(), p.y()))).as("tile %s", o).isTrue();
            assertThat(PlacementOptimizer.distanceToNearestWall(level, p.x(), p.y()))
                    .as("wall clearance %s", o).isGreaterThanOrEqualTo(rule.minDistanceFromWalls);
            assertThat(o.properties()).containsEntry("genre", "cyberpunk");
        }
        Map<ObjectType, List<GameObject>> byType = objects.stream().collect(Collectors.groupingBy(GameObject::type));
        byType.values().forEach(ObjectPlacementEngineTest::assertMutuallySpaced);
    }

    @Test
    void seededOverload_isReproducible() {
        GeneratedLevel level = openLevel(24, 18);

        List<GameObject> a = engine.placeObjects(level, ScenarioInput.ofGenre("fantasy"), Map.of());
        List<GameObject> b = engine.placeObjects(level, ScenarioInput.ofGenre("fantasy"), Map.of());

        assertThat(a).extracting(GameObject::id).isEqualTo(b.stream().map(GameObject::id).collect(Collectors.toList()));
        assertThat(a).extracting(GameObject::position).isEqualTo(b.stream().map(GameObject::position).collect(Collectors.toList()));
        assertThat(a).extracting(GameObject::properties).isEqualTo(b.stream().map(GameObject::properties).collect(Collectors.toList()));
    }

    @Test
    void analysesRunOnce_beforePlacement() {
        engine.placeObjects(openLevel(12, 12), ScenarioInput.ofGenre(""), Map.of(ObjectType.ITEM, 2), new Random(4L));

        assertThat(listener.started).containsExactly(
                StageId.PATHS, StageId.DIFFICULTY, StageId.VISIBILITY, StageId.PLACEMENT);
    }

    @Test
    void context_takesTheFirstPathAsPlayerPath() {
        PlacementContext ctx = engine.buildContext(openLevel(10, 8), ScenarioInput.ofGenre(""));

        assertThat(ctx.paths).hasSize(1);
        assertThat(ctx.playerPath).isEqualTo(ctx.paths.get(0));
        assertThat(ctx.playerPath.get(0)).isEqualTo(new GridPoint(1, 1));
        assertThat(ctx.difficulty.max()).isEqualTo(1.0);
    }

    private static void assertMutuallySpaced(List<GameObject> objects) {
        for (int i = 0; i < objects.size(); i++) {
            for (int j = i + 1; j < objects.size(); j++) {
                GameObject a = objects.get(i);
                GameObject b = objects.get(j);
                assertThat(a.position().distanceTo(b.position()))
                        .as("%s vs %s", a, b)
                        .isGreaterThanOrEqualTo(a.rule().minDistanceFromSameType);
            }
        }
    }
}
