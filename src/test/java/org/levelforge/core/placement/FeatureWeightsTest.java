package org.levelforge.core.placement;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class FeatureWeightsTest {

    @Test
    void defaultWeights_sumToOne() {
        FeatureWeights w = FeatureWeights.defaults();

        double sum = w.asMap().values().stream().mapToDouble(Double::doubleValue).sum();
        assertThat(sum).isCloseTo(1.0, within(1e-12));
        assertThat(w.weight(PlacementFeature.DISTANCE_TO_PATH)).isEqualTo(0.30);
        assertThat(w.weight(PlacementFeature.STRATEGIC)).isEqualTo(0.10);
    }

    @Test
    void score_isTheWeightedSum() {
        Map<PlacementFeature, Double> f = new EnumMap<>(PlacementFeature.class);
        f.put(PlacementFeature.DIFFICULTY, 1.0);
        f.put(PlacementFeature.CLUSTERING, 0.5);

        assertThat(FeatureWeights.defaults().score(f)).isCloseTo(0.25 + 0.075, within(1e-12));
    }

    @Test
    void missingEntries_weighZero() {
        Map<PlacementFeature, Double> only = new EnumMap<>(PlacementFeature.class);
        only.put(PlacementFeature.VISIBILITY, 1.0);
        FeatureWeights w = new FeatureWeights(only);

        assertThat(w.weight(PlacementFeature.DIFFICULTY)).isZero();
        assertThat(w.asMap()).hasSize(PlacementFeature.values().length);
    }
}
