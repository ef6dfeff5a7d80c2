package org.levelforge.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.levelforge.core.model.GameObject;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Debug dump of a level and its placed objects. Points are written as {@code [x, y]},
 * tiles as rows of tile codes.
 */
public class LevelDumpEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static String encode(GeneratedLevel level, List<GameObject> objects) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("level", levelNode(level));

        List<Object> objs = new ArrayList<>(objects.size());
        for (GameObject o : objects) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("id", o.id());
            node.put("type", o.type().tag());
            node.put("position", point(o.position()));
            node.put("properties", o.properties());
            node.put("influence_radius", o.influenceRadius());
            objs.add(node);
        }
        root.put("objects", objs);

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode level dump JSON", e);
        }
    }

    public static void write(Path out, GeneratedLevel level, List<GameObject> objects) {
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(out, encode(level, objects), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write level dump: " + out.toAbsolutePath(), e);
        }
    }

    private static Map<String, Object> levelNode(GeneratedLevel level) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("width", level.width());
        node.put("height", level.height());
        node.put("tiles", level.tiles().toCodes());
        node.put("spawn", points(level.spawnPoints()));
        node.put("goal", points(level.goalPoints()));

        Map<String, Object> special = new LinkedHashMap<>();
        level.specialAreas().forEach((k, v) -> special.put(k, points(v)));
        node.put("special", special);
        node.put("metadata", level.metadata());
        return node;
    }

    private static List<int[]> points(List<GridPoint> pts) {
        List<int[]> out = new ArrayList<>(pts.size());
        for (GridPoint p : pts) {
            out.add(point(p));
        }
        return out;
    }

    private static int[] point(GridPoint p) {
        return new int[]{p.x(), p.y()};
    }
}
