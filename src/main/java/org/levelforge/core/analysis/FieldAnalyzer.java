package org.levelforge.core.analysis;

import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;

import java.util.List;

/**
 * Per-tile analysis of a level given the analyzed player paths. Results are
 * max-normalized into [0, 1].
 */
public interface FieldAnalyzer {
    ScalarField analyze(GeneratedLevel level, List<List<GridPoint>> paths);
}
