package org.levelforge.core.placement;

import org.levelforge.core.analysis.ScalarField;
import org.levelforge.core.model.GeneratedLevel;
import org.levelforge.core.model.GridPoint;
import org.levelforge.core.model.ScenarioInput;

import java.util.List;

/**
 * Everything one placement call needs, computed once and dropped afterwards.
 */
public class PlacementContext {

    public final GeneratedLevel level;
    public final ScenarioInput scenario;

    /** All analyzed spawn-to-goal paths, possibly empty. */
    public final List<List<GridPoint>> paths;

    /** First analyzed path; empty when no spawn reaches a goal. */
    public final List<GridPoint> playerPath;

    public final ScalarField difficulty;
    public final ScalarField visibility;

    public PlacementContext(GeneratedLevel level,
                            ScenarioInput scenario,
                            List<List<GridPoint>> paths,
                            ScalarField difficulty,
                            ScalarField visibility) {
        this.level = level;
        this.scenario = scenario;
        this.paths = List.copyOf(paths);
        this.playerPath = paths.isEmpty() ? List.of() : List.copyOf(paths.get(0));
        this.difficulty = difficulty;
        this.visibility = visibility;
    }

    public String genre() {
        return scenario.genre();
    }
}
