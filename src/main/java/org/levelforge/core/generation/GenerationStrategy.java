package org.levelforge.core.generation;

import org.levelforge.core.model.TileGrid;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.GenerationConfig;

import java.util.Random;

/**
 * One base-grid algorithm. Implementations keep no random state of their own: the same
 * config and an identically seeded {@code rng} always produce the same grid.
 */
public interface GenerationStrategy {
    Algorithm algorithm();
    TileGrid generate(GenerationConfig config, Random rng);
}
