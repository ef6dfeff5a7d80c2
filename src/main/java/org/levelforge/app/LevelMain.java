package org.levelforge.app;

import org.levelforge.core.generation.ConsoleStageListener;
import org.levelforge.core.generation.LevelGenerator;
import org.levelforge.core.generation.LevelStats;
import org.levelforge.core.generation.LevelStatsReport;
import org.levelforge.core.io.AsciiLevelRenderer;
import org.levelforge.core.io.GenerationConfigLoader;
import org.levelforge.core.io.LevelDumpEncoder;
import org.levelforge.core.model.ScenarioInput;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.ConfigurationException;
import org.levelforge.core.model.config.GenerationConfig;
import org.levelforge.core.placement.ObjectPlacementEngine;
import org.levelforge.core.service.LevelBundle;
import org.levelforge.core.service.LevelGenerationService;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Generates one level, places objects and prints the map and a stats report.
 *
 * <pre>
 * LevelMain [--algorithm maze] [--width 40] [--height 25] [--seed 7] [--genre horror] [--dump out.json]
 * </pre>
 */
public class LevelMain {

    public static void main(String[] args) {
        GenerationConfig config;
        String genre;
        try {
            config = buildConfig(args);
            genre = pick(findOptionValue(args, "--genre"), "");
        } catch (ConfigurationException e) {
            System.err.println("[ERROR] " + e.getMessage());
            System.exit(2);
            return;
        }

        ConsoleStageListener listener = new ConsoleStageListener();
        LevelGenerationService service = new LevelGenerationService(
                new LevelGenerator(listener),
                new ObjectPlacementEngine(listener));

        LevelBundle bundle = service.generate(ScenarioInput.ofGenre(genre), config);

        System.out.println(AsciiLevelRenderer.render(bundle.level(), bundle.objects()));
        LevelStatsReport.print(LevelStats.compute(bundle.level(), bundle.objects()));

        String dump = findOptionValue(args, "--dump");
        if (dump != null) {
            Path out = Paths.get(dump);
            LevelDumpEncoder.write(out, bundle.level(), bundle.objects());
            System.out.println("[DUMP] " + out.toAbsolutePath());
        }
    }

    static GenerationConfig buildConfig(String[] args) {
        GenerationConfig.Builder b = GenerationConfigLoader.load();

        String algorithm = findOptionValue(args, "--algorithm");
        if (algorithm != null) b.algorithm = Algorithm.fromTag(algorithm);

        String width = findOptionValue(args, "--width");
        if (width != null) b.width = parseInt("--width", width);

        String height = findOptionValue(args, "--height");
        if (height != null) b.height = parseInt("--height", height);

        String seed = findOptionValue(args, "--seed");
        if (seed != null) {
            try {
                b.seed = Long.parseLong(seed.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid value for --seed: '" + seed + "'", e);
            }
        }
        return b.build();
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid value for " + option + ": '" + value + "'", e);
        }
    }

    private static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static String pick(String candidate, String fallback) {
        if (candidate == null) return fallback;
        String trimmed = candidate.trim();
        return trimmed.isEmpty() ? fallback : trimmed;
    }
}
