package org.levelforge.core.model;

/**
 * Scenario request coming from the narrative side. Only {@code genre} drives level
 * generation and placement; the rest is carried for collaborators.
 */
public record ScenarioInput(String genre, String hero, String goal, String language) {

    public ScenarioInput {
        if (genre == null) genre = "";
    }

    public static ScenarioInput ofGenre(String genre) {
        return new ScenarioInput(genre, "", "", "en");
    }
}
