package org.levelforge.core.generation;

import org.levelforge.core.io.GenreTableLoader;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Genre lookup by name or alias, case-insensitive. Unknown genres map to
 * {@link GenreProfile#NEUTRAL}, which changes nothing.
 */
public class GenreCatalog {

    public static final String DEFAULT_RESOURCE = "genres.json";

    private final Map<String, GenreProfile> byKey = new LinkedHashMap<>();
    private final List<GenreProfile> profiles;

    public GenreCatalog(List<GenreProfile> profiles) {
        this.profiles = List.copyOf(profiles);
        for (GenreProfile p : profiles) {
            byKey.put(key(p.name()), p);
            for (String alias : p.aliases()) {
                byKey.put(key(alias), p);
            }
        }
    }

    /** Catalog bundled with the library ({@value #DEFAULT_RESOURCE}). */
    public static GenreCatalog defaults() {
        return Holder.DEFAULTS;
    }

    public GenreProfile lookup(String genre) {
        if (genre == null) return GenreProfile.NEUTRAL;
        return byKey.getOrDefault(key(genre), GenreProfile.NEUTRAL);
    }

    public Collection<GenreProfile> profiles() {
        return profiles;
    }

    private static String key(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }

    private static final class Holder {
        static final GenreCatalog DEFAULTS = GenreTableLoader.loadResource(DEFAULT_RESOURCE);
    }
}
