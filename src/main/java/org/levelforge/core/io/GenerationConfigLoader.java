package org.levelforge.core.io;

import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.ConfigurationException;
import org.levelforge.core.model.config.GenerationConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;

/**
 * Fills a {@link GenerationConfig.Builder} from a local properties file, then from
 * {@code -Dlevelgen.*} system properties. Later sources win.
 */
public final class GenerationConfigLoader {

    public static final String PREFIX = "levelgen.";
    public static final String PATH_PROPERTY = "levelgen.config.path";
    public static final String PATH_ENV = "LEVELGEN_CONFIG_PATH";

    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "levelgen.properties");

    private static final List<String> INT_KEYS = List.of(
            GenerationConfig.ITERATIONS,
            GenerationConfig.OCTAVES,
            GenerationConfig.ROOM_COUNT,
            GenerationConfig.CORRIDOR_WIDTH);

    private static final List<String> DOUBLE_KEYS = List.of(
            GenerationConfig.WALL_PROBABILITY,
            GenerationConfig.NOISE_SCALE,
            GenerationConfig.PERSISTENCE,
            GenerationConfig.LACUNARITY);

    private GenerationConfigLoader() {
    }

    /** File from {@link #resolvePath()} (skipped when missing), then system properties. */
    public static GenerationConfig.Builder load() {
        GenerationConfig.Builder b = new GenerationConfig.Builder();
        apply(b, resolvePath());
        applyOverridesFromSystem(b);
        return b;
    }

    public static void apply(GenerationConfig.Builder b, Path path) {
        if (path == null || !Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read level generator config: " + path.toAbsolutePath(), e);
        }
        applyProperties(b, props);
    }

    public static void applyOverridesFromSystem(GenerationConfig.Builder b) {
        applyProperties(b, System.getProperties());
    }

    public static void applyProperties(GenerationConfig.Builder b, Properties props) {
        String width = pick(props.getProperty(PREFIX + "width"));
        if (width != null) b.width = parseInt("width", width);

        String height = pick(props.getProperty(PREFIX + "height"));
        if (height != null) b.height = parseInt("height", height);

        String algorithm = pick(props.getProperty(PREFIX + "algorithm"));
        if (algorithm != null) b.algorithm = Algorithm.fromTag(algorithm);

        String seed = pick(props.getProperty(PREFIX + "seed"));
        if (seed != null) b.seed = parseLong("seed", seed);

        for (String key : INT_KEYS) {
            String v = pick(props.getProperty(PREFIX + key));
            if (v != null) b.applyOverride(key, parseInt(key, v));
        }
        for (String key : DOUBLE_KEYS) {
            String v = pick(props.getProperty(PREFIX + key));
            if (v != null) b.applyOverride(key, parseDouble(key, v));
        }
    }

    static Path resolvePath() {
        String override = pick(
                System.getProperty(PATH_PROPERTY),
                System.getenv(PATH_ENV)
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + PREFIX + key + ": '" + value + "'", e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + PREFIX + key + ": '" + value + "'", e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + PREFIX + key + ": '" + value + "'", e);
        }
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value == null) continue;
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return null;
    }
}
