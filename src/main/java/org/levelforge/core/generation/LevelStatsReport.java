package org.levelforge.core.generation;

import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.TileType;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;

public class LevelStatsReport {

    public static void print(LevelStats s) {
        print(s, System.out);
    }

    public static void print(LevelStats s, PrintStream out) {
        out.println();
        out.println("========= LEVEL STATS =========");
        out.println("Size: " + s.width + "x" + s.height + " (" + s.tileCount + " tiles)");
        out.println("Algorithm: " + s.algorithm + "  genre: " + blankAsDash(s.genre) + "  seed: " + s.seed);
        out.println("Walkable: " + s.walkableCount + " (" + pct(s.walkableCount, s.tileCount) + ")");

        out.println();
        out.println("Tile types:");
        for (Map.Entry<TileType, Integer> e : s.tileCounts.entrySet()) {
            if (e.getValue() == 0) continue;
            out.println("  " + pad(e.getKey().name()) + " : " + e.getValue());
        }

        out.println();
        out.println("Spawn points: " + s.spawnCount + "  goal points: " + s.goalCount);
        if (!s.specialAreaCounts.isEmpty()) {
            out.println("Special areas: " + s.specialAreaCounts);
        }

        out.println();
        out.println("Objects: " + s.objectTotal);
        for (Map.Entry<ObjectType, Integer> e : s.objectCounts.entrySet()) {
            out.println("  " + pad(e.getKey().tag()) + " : " + e.getValue());
        }
        out.println("================================");
        out.println();
    }

    private static String pct(int part, int total) {
        if (total <= 0) return "0.0%";
        return String.format(Locale.US, "%.1f%%", 100.0 * part / total);
    }

    private static String blankAsDash(String v) {
        return (v == null || v.isEmpty()) ? "-" : v;
    }

    private static String pad(String name) {
        return String.format("%-14s", name);
    }
}
