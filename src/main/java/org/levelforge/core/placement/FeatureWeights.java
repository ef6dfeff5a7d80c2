package org.levelforge.core.placement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Named weight table for the placement score. The score of a position is the weighted
 * sum of its feature values.
 */
public class FeatureWeights {

    private final Map<PlacementFeature, Double> weights;

    public FeatureWeights(Map<PlacementFeature, Double> weights) {
        EnumMap<PlacementFeature, Double> copy = new EnumMap<>(PlacementFeature.class);
        for (PlacementFeature f : PlacementFeature.values()) {
            copy.put(f, weights.getOrDefault(f, 0.0));
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static FeatureWeights defaults() {
        EnumMap<PlacementFeature, Double> w = new EnumMap<>(PlacementFeature.class);
        w.put(PlacementFeature.DISTANCE_TO_PATH, 0.30);
        w.put(PlacementFeature.DIFFICULTY, 0.25);
        w.put(PlacementFeature.VISIBILITY, 0.20);
        w.put(PlacementFeature.CLUSTERING, 0.15);
        w.put(PlacementFeature.STRATEGIC, 0.10);
        return new FeatureWeights(w);
    }

    public double weight(PlacementFeature feature) {
        return weights.get(feature);
    }

    public Map<PlacementFeature, Double> asMap() {
        return weights;
    }

    public double score(Map<PlacementFeature, Double> features) {
        double s = 0.0;
        for (Map.Entry<PlacementFeature, Double> e : features.entrySet()) {
            s += weights.get(e.getKey()) * e.getValue();
        }
        return s;
    }
}
