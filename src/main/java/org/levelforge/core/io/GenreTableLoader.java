package org.levelforge.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.levelforge.core.generation.GenreCatalog;
import org.levelforge.core.generation.GenreProfile;
import org.levelforge.core.model.ObjectType;
import org.levelforge.core.model.TileType;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads genre tables from JSON:
 * <pre>
 * {"genres": [{"name": "horror", "aliases": [...],
 *              "generation": {"wall_probability": 0.6, ...},
 *              "special_tiles": ["TRAP"],
 *              "object_multipliers": {"TRAP": 2.0, ...}}]}
 * </pre>
 */
public final class GenreTableLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GenreTableLoader() {
    }

    public static GenreCatalog loadResource(String resource) {
        try (InputStream in = GenreTableLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Genre table resource not found: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read genre table: " + resource, e);
        }
    }

    public static GenreCatalog load(InputStream in) throws IOException {
        return parse(MAPPER.readTree(in));
    }

    public static GenreCatalog parse(String json) throws IOException {
        return parse(MAPPER.readTree(json));
    }

    private static GenreCatalog parse(JsonNode root) {
        JsonNode genres = root.path("genres");
        if (!genres.isArray()) {
            throw new IllegalStateException("Genre table has no 'genres' array");
        }

        List<GenreProfile> out = new ArrayList<>();
        for (JsonNode g : genres) {
            String name = g.path("name").asText("").trim();
            if (name.isEmpty()) {
                throw new IllegalStateException("Genre entry without a name: " + g);
            }

            List<String> aliases = new ArrayList<>();
            for (JsonNode a : g.path("aliases")) aliases.add(a.asText());

            Map<String, Number> generation = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = g.path("generation").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> e = fields.next();
                if (!e.getValue().isNumber()) {
                    throw new IllegalStateException("Genre '" + name + "': generation value '" + e.getKey()
                            + "' is not a number");
                }
                generation.put(e.getKey(), e.getValue().numberValue());
            }

            List<TileType> specials = new ArrayList<>();
            for (JsonNode t : g.path("special_tiles")) {
                specials.add(enumValue(TileType.class, t.asText(), name));
            }

            Map<ObjectType, Double> multipliers = new EnumMap<>(ObjectType.class);
            Iterator<Map.Entry<String, JsonNode>> mult = g.path("object_multipliers").fields();
            while (mult.hasNext()) {
                Map.Entry<String, JsonNode> e = mult.next();
                multipliers.put(enumValue(ObjectType.class, e.getKey(), name), e.getValue().asDouble(1.0));
            }

            out.add(new GenreProfile(name, aliases, generation, specials, multipliers));
        }
        return new GenreCatalog(out);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String raw, String genre) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Genre '" + genre + "': unknown " + type.getSimpleName() + " '" + raw + "'", e);
        }
    }
}
