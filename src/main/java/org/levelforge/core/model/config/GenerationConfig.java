package org.levelforge.core.model.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable level generation request. Instances come from {@link Builder#build()},
 * which performs all validation, so a config that exists is a config every strategy
 * accepts.
 */
public final class GenerationConfig {

    public static final String WALL_PROBABILITY = "wall_probability";
    public static final String ITERATIONS = "iterations";
    public static final String NOISE_SCALE = "noise_scale";
    public static final String OCTAVES = "octaves";
    public static final String PERSISTENCE = "persistence";
    public static final String LACUNARITY = "lacunarity";
    public static final String ROOM_COUNT = "room_count";
    public static final String CORRIDOR_WIDTH = "corridor_width";

    public final int width;
    public final int height;
    public final Algorithm algorithm;
    /** null = pick a fresh seed per call */
    public final Long seed;

    // cellular automaton
    public final double wallProbability;
    public final int iterations;

    // noise
    public final double noiseScale;
    public final int octaves;
    public final double persistence;
    public final double lacunarity;

    // hybrid
    public final int roomCount;
    public final int corridorWidth;

    /** Per-request overrides applied on top of the genre table. */
    public final Map<String, Number> genreModifiers;

    private GenerationConfig(Builder b) {
        this.width = b.width;
        this.height = b.height;
        this.algorithm = b.algorithm;
        this.seed = b.seed;
        this.wallProbability = b.wallProbability;
        this.iterations = b.iterations;
        this.noiseScale = b.noiseScale;
        this.octaves = b.octaves;
        this.persistence = b.persistence;
        this.lacunarity = b.lacunarity;
        this.roomCount = b.roomCount;
        this.corridorWidth = b.corridorWidth;
        this.genreModifiers = Collections.unmodifiableMap(new LinkedHashMap<>(b.genreModifiers));
    }

    public static GenerationConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder(int width, int height, Algorithm algorithm) {
        Builder b = new Builder();
        b.width = width;
        b.height = height;
        b.algorithm = algorithm;
        return b;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.width = width;
        b.height = height;
        b.algorithm = algorithm;
        b.seed = seed;
        b.wallProbability = wallProbability;
        b.iterations = iterations;
        b.noiseScale = noiseScale;
        b.octaves = octaves;
        b.persistence = persistence;
        b.lacunarity = lacunarity;
        b.roomCount = roomCount;
        b.corridorWidth = corridorWidth;
        b.genreModifiers = new LinkedHashMap<>(genreModifiers);
        return b;
    }

    public GenerationConfig withSeed(long newSeed) {
        Builder b = toBuilder();
        b.seed = newSeed;
        return b.build();
    }

    /** Full parameter snapshot, keyed the way level metadata reports it. */
    public Map<String, Object> toParameterMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("width", width);
        m.put("height", height);
        m.put("algorithm", algorithm.tag());
        m.put("seed", seed);
        m.put(WALL_PROBABILITY, wallProbability);
        m.put(ITERATIONS, iterations);
        m.put(NOISE_SCALE, noiseScale);
        m.put(OCTAVES, octaves);
        m.put(PERSISTENCE, persistence);
        m.put(LACUNARITY, lacunarity);
        m.put(ROOM_COUNT, roomCount);
        m.put(CORRIDOR_WIDTH, corridorWidth);
        m.put("genre_modifiers", genreModifiers);
        return m;
    }

    @Override
    public String toString() {
        return "GenerationConfig" + toParameterMap();
    }

    public static class Builder {
        public int width = 32;
        public int height = 32;
        public Algorithm algorithm = Algorithm.PATTERN_COLLAPSE;
        public Long seed;

        public double wallProbability = 0.45;
        public int iterations = 5;

        public double noiseScale = 0.1;
        public int octaves = 4;
        public double persistence = 0.5;
        public double lacunarity = 2.0;

        public int roomCount = 5;
        public int corridorWidth = 2;

        public Map<String, Number> genreModifiers = new LinkedHashMap<>();

        /**
         * Overwrites the parameter named by {@code key}. Returns false for keys that are
         * not generation parameters; those are left alone.
         */
        public boolean applyOverride(String key, Number value) {
            if (key == null || value == null) return false;
            switch (key.trim().toLowerCase(Locale.ROOT)) {
                case WALL_PROBABILITY -> wallProbability = value.doubleValue();
                case ITERATIONS -> iterations = value.intValue();
                case NOISE_SCALE -> noiseScale = value.doubleValue();
                case OCTAVES -> octaves = value.intValue();
                case PERSISTENCE -> persistence = value.doubleValue();
                case LACUNARITY -> lacunarity = value.doubleValue();
                case ROOM_COUNT -> roomCount = value.intValue();
                case CORRIDOR_WIDTH -> corridorWidth = value.intValue();
                default -> {
                    return false;
                }
            }
            return true;
        }

        public GenerationConfig build() {
            if (width <= 0 || height <= 0) {
                throw new ConfigurationException("Level dimensions must be positive: " + width + "x" + height);
            }
            if (algorithm == null) {
                throw new ConfigurationException("Algorithm is not set");
            }
            if (algorithm == Algorithm.MAZE && (oddFloor(width) < 3 || oddFloor(height) < 3)) {
                throw new ConfigurationException("Maze needs at least 3x3 after odd reduction: " + width + "x" + height);
            }
            if (Double.isNaN(wallProbability) || wallProbability < 0.0 || wallProbability > 1.0) {
                throw new ConfigurationException("wall_probability out of [0,1]: " + wallProbability);
            }
            if (iterations < 0) {
                throw new ConfigurationException("iterations must be >= 0: " + iterations);
            }
            if (!(noiseScale > 0.0)) {
                throw new ConfigurationException("noise_scale must be positive: " + noiseScale);
            }
            if (octaves < 1) {
                throw new ConfigurationException("octaves must be >= 1: " + octaves);
            }
            if (roomCount < 0) {
                throw new ConfigurationException("room_count must be >= 0: " + roomCount);
            }
            if (corridorWidth < 1) {
                throw new ConfigurationException("corridor_width must be >= 1: " + corridorWidth);
            }
            if (genreModifiers == null) {
                genreModifiers = new LinkedHashMap<>();
            }
            return new GenerationConfig(this);
        }

        private static int oddFloor(int v) {
            return (v % 2 == 0) ? v - 1 : v;
        }
    }
}
