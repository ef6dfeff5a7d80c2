package org.levelforge.core.placement;

import org.levelforge.core.model.ObjectType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Gameplay properties for a freshly placed object. Integer ranges are inclusive; real
 * ranges are half-open.
 */
public class ObjectPropertyGenerator {

    public static final String GENRE = "genre";

    static final List<String> AI_TYPES = List.of("patrol", "guard", "aggressive");
    static final List<String> ITEM_TYPES = List.of("weapon", "armor", "consumable", "key");
    static final List<String> TRAP_TYPES = List.of("spike", "poison", "explosive", "alarm");
    static final List<String> TREASURE_TYPES = List.of("gold", "gems", "artifact");

    public Map<String, Object> generate(ObjectType type, String genre, Random rng) {
        Map<String, Object> p = new LinkedHashMap<>();
        switch (type) {
            case ENEMY -> {
                p.put("health", randInt(rng, 50, 150));
                p.put("damage", randInt(rng, 10, 30));
                p.put("ai_type", pick(rng, AI_TYPES));
                p.put("detection_radius", uniform(rng, 3.0, 7.0));
            }
            case ITEM -> {
                p.put("item_type", pick(rng, ITEM_TYPES));
                p.put("value", randInt(rng, 10, 100));
                p.put("stackable", rng.nextBoolean());
            }
            case TRAP -> {
                p.put("trap_type", pick(rng, TRAP_TYPES));
                p.put("damage", randInt(rng, 20, 50));
                p.put("detection_difficulty", uniform(rng, 0.3, 0.8));
            }
            case TREASURE -> {
                p.put("treasure_type", pick(rng, TREASURE_TYPES));
                p.put("value", randInt(rng, 100, 500));
                p.put("hidden", rng.nextBoolean());
            }
            default -> {
                // no type-specific properties
            }
        }
        p.put(GENRE, genre);
        return p;
    }

    private static int randInt(Random rng, int lo, int hi) {
        return lo + rng.nextInt(hi - lo + 1);
    }

    private static double uniform(Random rng, double lo, double hi) {
        return lo + rng.nextDouble() * (hi - lo);
    }

    private static String pick(Random rng, List<String> options) {
        return options.get(rng.nextInt(options.size()));
    }
}
