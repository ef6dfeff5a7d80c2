package org.levelforge.core.generation;

import org.levelforge.core.generation.strategies.CellularAutomatonStrategy;
import org.levelforge.core.generation.strategies.HybridStrategy;
import org.levelforge.core.generation.strategies.MazeStrategy;
import org.levelforge.core.generation.strategies.NoiseTerrainStrategy;
import org.levelforge.core.generation.strategies.PatternCollapseStrategy;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.ScenarioInput;
import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.TileType;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.ConfigurationException;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Builds a {@link GeneratedLevel} for a scenario: genre modifiers, base grid from the
 * selected strategy, special tile scatter, then spawn/goal/special-area derivation.
 *
 * The generator itself holds only immutable tables; every call gets its own grid and its
 * own {@link Random}, so independent calls may run on separate threads. Failures are not
 * retried here; picking a new seed is up to the caller.
 */
public class LevelGenerator {

    static final int SPAWN_POINT_COUNT = 3;
    static final int GOAL_POINT_COUNT = 2;
    static final int MAX_SPECIAL_TILES = 5;
    /** at most one special tile per this many floor tiles */
    static final int FLOOR_TILES_PER_SPECIAL = 10;

    static final List<TileType> SPECIAL_AREA_TYPES = List.of(TileType.SECRET, TileType.TRAP, TileType.WATER);

    private final GenreCatalog genres;
    private final Map<Algorithm, GenerationStrategy> strategies = new EnumMap<>(Algorithm.class);
    private final boolean enableValidation;
    private final StageListener listener;

    public LevelGenerator(GenreCatalog genres,
                          List<GenerationStrategy> strategies,
                          boolean enableValidation,
                          StageListener listener) {
        this.genres = genres;
        this.enableValidation = enableValidation;
        this.listener = (listener != null) ? listener : new ConsoleStageListener();
        for (GenerationStrategy s : strategies) {
            this.strategies.put(s.algorithm(), s);
        }
    }

    public LevelGenerator(StageListener listener) {
        this(GenreCatalog.defaults(), defaultStrategies(), true, listener);
    }

    /**
     * Bundled genre tables, every built-in strategy, validation on, console output.
     */
    public LevelGenerator() {
        this(new ConsoleStageListener());
    }

    public static List<GenerationStrategy> defaultStrategies() {
        return List.of(
                new CellularAutomatonStrategy(),
                new NoiseTerrainStrategy(),
                new MazeStrategy(),
                new PatternCollapseStrategy(),
                new HybridStrategy()
        );
    }

    public GeneratedLevel generateLevel(ScenarioInput scenario, GenerationConfig requested) {
        GenerationConfig base = (requested != null) ? requested : GenerationConfig.defaults();
        GenreProfile genre = genres.lookup(scenario.genre());

        GenerationConfig tuned = Stages.call(listener, StageId.GENRE_MODIFIERS, "Genre Modifiers",
                () -> applyGenreModifiers(base, genre));

        GenerationStrategy strategy = strategies.get(tuned.algorithm);
        if (strategy == null) {
            throw new ConfigurationException("No strategy registered for algorithm: " + tuned.algorithm.tag());
        }

        long seed = (tuned.seed != null) ? tuned.seed : new Random().nextLong();
        GenerationConfig config = tuned.withSeed(seed);
        Random rng = new Random(seed);

        TileGrid baseGrid = Stages.call(listener, StageId.BASE_GRID, "Base Grid (" + config.algorithm.tag() + ")", () -> {
            TileGrid g = strategy.generate(config, rng);
            if (enableValidation) Validation.afterBaseGrid(g, config);
            return g;
        });

        TileGrid grid = Stages.call(listener, StageId.POST_PROCESS, "Special Tiles",
                () -> scatterSpecialTiles(baseGrid, genre.specialTiles(), rng));

        List<GridPoint> spawns = Stages.call(listener, StageId.SPAWN_POINTS, "Spawn Points", () -> {
            List<GridPoint> p = findSpawnPoints(grid);
            if (enableValidation) Validation.afterPoints(grid, "spawn", p);
            return p;
        });

        List<GridPoint> goals = Stages.call(listener, StageId.GOAL_POINTS, "Goal Points", () -> {
            List<GridPoint> p = findGoalPoints(grid);
            if (enableValidation) Validation.afterPoints(grid, "goal", p);
            return p;
        });

        Map<String, List<GridPoint>> specialAreas = Stages.call(listener, StageId.SPECIAL_AREAS, "Special Areas", () -> {
            Map<String, List<GridPoint>> a = findSpecialAreas(grid);
            if (enableValidation) Validation.afterSpecialAreas(grid, a);
            return a;
        });

        Map<String, Object> metadata = Stages.call(listener, StageId.METADATA, "Metadata", () -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put(GeneratedLevel.META_ALGORITHM, config.algorithm.tag());
            m.put(GeneratedLevel.META_GENRE, scenario.genre());
            m.put(GeneratedLevel.META_SEED, seed);
            m.put(GeneratedLevel.META_PARAMETERS, config.toParameterMap());
            return m;
        });

        GeneratedLevel level = new GeneratedLevel(grid, spawns, goals, specialAreas, metadata);
        if (enableValidation) {
            Validation.afterLevel(level);
        }
        return level;
    }

    /**
     * Genre table first, then the request's own modifiers. Only keys naming a generation
     * parameter are applied; anything else in the tables is ignored.
     */
    public static GenerationConfig applyGenreModifiers(GenerationConfig config, GenreProfile genre) {
        if (genre.generationOverrides().isEmpty() && config.genreModifiers.isEmpty()) {
            return config;
        }
        GenerationConfig.Builder b = config.toBuilder();
        genre.generationOverrides().forEach(b::applyOverride);
        config.genreModifiers.forEach(b::applyOverride);
        return b.build();
    }

    /**
     * Scatters up to {@value #MAX_SPECIAL_TILES} special tiles (and no more than one per
     * {@value #FLOOR_TILES_PER_SPECIAL} floor tiles) onto distinct floor tiles. Works on a
     * copy; the input grid is left untouched.
     */
    static TileGrid scatterSpecialTiles(TileGrid base, List<TileType> specialTiles, Random rng) {
        TileGrid out = base.copy();
        if (specialTiles.isEmpty()) return out;

        List<GridPoint> floor = out.positionsOf(TileType.FLOOR);
        int count = Math.min(floor.size() / FLOOR_TILES_PER_SPECIAL, MAX_SPECIAL_TILES);

        // partial Fisher-Yates: the first `count` entries become a uniform sample
        for (int i = 0; i < count; i++) {
            int j = i + rng.nextInt(floor.size() - i);
            GridPoint tmp = floor.get(i);
            floor.set(i, floor.get(j));
            floor.set(j, tmp);

            GridPoint p = floor.get(i);
            out.set(p.x(), p.y(), specialTiles.get(i % specialTiles.size()));
        }
        return out;
    }

    /**
     * Floor tiles closest to a grid corner. Ties keep row-major order (lower y, then lower x).
     */
    static List<GridPoint> findSpawnPoints(TileGrid grid) {
        List<GridPoint> floor = grid.positionsOf(TileType.FLOOR);
        if (floor.isEmpty()) {
            System.out.println("[WARN] No floor tiles for spawn points, using fallback");
            return List.of(clampToGrid(grid, 1, 1));
        }
        return rankByCornerDistance(grid, floor, false, SPAWN_POINT_COUNT);
    }

    /**
     * Existing goal tiles if the grid has any, else the floor tiles farthest from every
     * corner. Ties keep row-major order.
     */
    static List<GridPoint> findGoalPoints(TileGrid grid) {
        List<GridPoint> marked = grid.positionsOf(TileType.GOAL);
        if (!marked.isEmpty()) {
            return marked;
        }
        List<GridPoint> floor = grid.positionsOf(TileType.FLOOR);
        if (floor.isEmpty()) {
            System.out.println("[WARN] No floor tiles for goal points, using fallback");
            return List.of(clampToGrid(grid, grid.width() - 2, grid.height() - 2));
        }
        return rankByCornerDistance(grid, floor, true, GOAL_POINT_COUNT);
    }

    static Map<String, List<GridPoint>> findSpecialAreas(TileGrid grid) {
        Map<String, List<GridPoint>> areas = new LinkedHashMap<>();
        for (TileType type : SPECIAL_AREA_TYPES) {
            List<GridPoint> positions = grid.positionsOf(type);
            if (!positions.isEmpty()) {
                areas.put(type.name().toLowerCase(Locale.ROOT), positions);
            }
        }
        return areas;
    }

    static double minCornerDistance(TileGrid grid, GridPoint p) {
        int maxX = grid.width() - 1;
        int maxY = grid.height() - 1;
        double d = GridPoint.distance(p.x(), p.y(), 0, 0);
        d = Math.min(d, GridPoint.distance(p.x(), p.y(), maxX, 0));
        d = Math.min(d, GridPoint.distance(p.x(), p.y(), 0, maxY));
        d = Math.min(d, GridPoint.distance(p.x(), p.y(), maxX, maxY));
        return d;
    }

    private static List<GridPoint> rankByCornerDistance(TileGrid grid, List<GridPoint> candidates,
                                                        boolean farthestFirst, int limit) {
        Comparator<GridPoint> byDistance = Comparator.comparingDouble(p -> minCornerDistance(grid, p));
        if (farthestFirst) byDistance = byDistance.reversed();

        // List.sort is stable, candidates arrive in row-major order
        List<GridPoint> ranked = new ArrayList<>(candidates);
        ranked.sort(byDistance);
        return new ArrayList<>(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    private static GridPoint clampToGrid(TileGrid grid, int x, int y) {
        return new GridPoint(
                Math.max(0, Math.min(grid.width() - 1, x)),
                Math.max(0, Math.min(grid.height() - 1, y)));
    }
}
