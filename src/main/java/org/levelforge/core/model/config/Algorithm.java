package org.levelforge.core.model.config;

import java.util.List;
import java.util.Locale;

public enum Algorithm {
    CELLULAR("cellular"),
    NOISE("perlin", "noise"),
    MAZE("maze"),
    PATTERN_COLLAPSE("wfc", "pattern"),
    HYBRID("hybrid");

    private final String tag;
    private final List<String> aliases;

    Algorithm(String tag, String... aliases) {
        this.tag = tag;
        this.aliases = List.of(aliases);
    }

    /** Canonical tag, as written to level metadata. */
    public String tag() {
        return tag;
    }

    public static Algorithm fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Algorithm tag is empty");
        }
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (Algorithm a : values()) {
            if (a.tag.equals(t) || a.aliases.contains(t)) return a;
        }
        throw new ConfigurationException("Unknown algorithm: " + tag);
    }
}
