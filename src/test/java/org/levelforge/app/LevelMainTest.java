package org.levelforge.app;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.levelforge.core.model.config.Algorithm;
import org.levelforge.core.model.config.ConfigurationException;
import org.levelforge.core.model.config.GenerationConfig;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LevelMainTest {

    @Test
    void buildConfig_readsOptions() {
        GenerationConfig c = LevelMain.buildConfig(new String[]{
                "--algorithm", "maze", "--width", "41", "--height", "21", "--seed", "7", "--genre", "horror"});

        assertThat(c.algorithm).isEqualTo(Algorithm.MAZE);
        assertThat(c.width).isEqualTo(41);
        assertThat(c.height).isEqualTo(21);
        assertThat(c.seed).isEqualTo(7L);
    }

    @Test
    void buildConfig_rejectsBadNumbers() {
        assertThatThrownBy(() -> LevelMain.buildConfig(new String[]{"--width", "wide"}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("--width");
    }
}
