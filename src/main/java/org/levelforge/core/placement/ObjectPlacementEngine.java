package org.levelforge.core.placement;

import org.levelforge.core.analysis.DifficultyZoneAnalyzer;
import org.levelforge.core.analysis.PathAnalyzer;
import org.levelforge.core.analysis.ScalarField;
import org.levelforge.core.analysis.VisibilityAnalyzer;
import org.levelforge.core.generation.ConsoleStageListener;
import org.levelforge.core.generation.GenreCatalog;
import org.levelforge.core.generation.GenreProfile;
import org.levelforge.core.generation.StageId;
import org.levelforge.core.generation.StageListener;
import org.levelforge.core.generation.Stages;
import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.PlacementRule;
import org.levelforge.core.model.ScenarioInput;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Places gameplay objects on a generated level. Analyses (paths, difficulty, visibility)
 * run once per call and feed a single {@link PlacementContext}.
 */
public class ObjectPlacementEngine {

    /** Lower bounds for derived counts, keyed by type. Types not listed get no objects. */
    static final Map<ObjectType, Integer> MIN_COUNTS;
    static {
        Map<ObjectType, Integer> m = new EnumMap<>(ObjectType.class);
        m.put(ObjectType.ENEMY, 1);
        m.put(ObjectType.ITEM, 2);
        m.put(ObjectType.TRAP, 1);
        m.put(ObjectType.TREASURE, 1);
        m.put(ObjectType.DECORATION, 3);
        MIN_COUNTS = Collections.unmodifiableMap(m);
    }

    private final GenreCatalog genres;
    private final Map<ObjectType, PlacementRule> rules;
    private final PlacementOptimizer optimizer;
    private final PathAnalyzer pathAnalyzer = new PathAnalyzer();
    private final DifficultyZoneAnalyzer difficultyAnalyzer = new DifficultyZoneAnalyzer();
    private final VisibilityAnalyzer visibilityAnalyzer = new VisibilityAnalyzer();
    private final StageListener listener;

    public ObjectPlacementEngine(GenreCatalog genres,
                                 Map<ObjectType, PlacementRule> rules,
                                 PlacementOptimizer optimizer,
                                 StageListener listener) {
        this.genres = genres;
        this.rules = rules;
        this.optimizer = optimizer;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();
    }

    public ObjectPlacementEngine(StageListener listener) {
        this(GenreCatalog.defaults(), PlacementRules.defaults(), new PlacementOptimizer(), listener);
    }

    public ObjectPlacementEngine() {
        this(new ConsoleStageListener());
    }

    public Map<ObjectType, PlacementRule> rules() {
        return rules;
    }

    /**
     * Places objects with a generator seeded from the level's recorded seed, so the same
     * level always receives the same objects. Levels without a seed get a fresh one.
     */
    public List<GameObject> placeObjects(GeneratedLevel level,
                                         ScenarioInput scenario,
                                         Map<ObjectType, Integer> explicitCounts) {
        Long seed = level.seed();
        Random rng = (seed != null) ? new Random(seed) : new Random();
        return placeObjects(level, scenario, explicitCounts, rng);
    }

    /**
     * @param explicitCounts requested count per type; null or empty derives counts from the
     *                       walkable area and the scenario genre
     */
    public List<GameObject> placeObjects(GeneratedLevel level,
                                         ScenarioInput scenario,
                                         Map<ObjectType, Integer> explicitCounts,
                                         Random rng) {
        Map<ObjectType, Integer> counts = (explicitCounts == null || explicitCounts.isEmpty())
                ? deriveObjectCounts(level, scenario)
                : explicitCounts;

        PlacementContext ctx = buildContext(level, scenario);

        return Stages.call(listener, StageId.PLACEMENT, "Object placement",
                () -> optimizer.optimizePlacement(ctx, counts, rules, rng));
    }

    public PlacementContext buildContext(GeneratedLevel level, ScenarioInput scenario) {
        List<List<GridPoint>> paths = Stages.call(listener, StageId.PATHS, "Player paths",
                () -> pathAnalyzer.findPlayerPaths(level));
        ScalarField difficulty = Stages.call(listener, StageId.DIFFICULTY, "Difficulty zones",
                () -> difficultyAnalyzer.analyzeDifficultyZones(level, paths));
        ScalarField visibility = Stages.call(listener, StageId.VISIBILITY, "Visibility map",
                () -> visibilityAnalyzer.computeVisibilityMap(level, paths));
        return new PlacementContext(level, scenario, paths, difficulty, visibility);
    }

    /** Area-proportional counts from the rule densities, then the genre multipliers. */
    public Map<ObjectType, Integer> deriveObjectCounts(GeneratedLevel level, ScenarioInput scenario) {
        int area = level.tiles().countWalkable();
        GenreProfile genre = genres.lookup(scenario.genre());

        Map<ObjectType, Integer> counts = new EnumMap<>(ObjectType.class);
        for (Map.Entry<ObjectType, Integer> e : MIN_COUNTS.entrySet()) {
            ObjectType type = e.getKey();
            PlacementRule rule = rules.getOrDefault(type, PlacementRule.defaultsFor(type));
            int base = Math.max(e.getValue(), (int) (area * rule.densityPerArea));
            int scaled = Math.max(1, (int) (base * genre.multiplierFor(type)));
            counts.put(type, scaled);
        }
        return counts;
    }
}
