package org.levelforge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A placed object. The position satisfied its rule when the object was created; it is
 * not re-validated afterwards.
 */
public class GameObject {

    public static final double DEFAULT_INFLUENCE_RADIUS = 3.0;

    private final String id;
    private final ObjectType type;
    private final GridPoint position;
    private final Map<String, Object> properties;
    private final double influenceRadius;
    private final PlacementRule rule;

    public GameObject(String id,
                      ObjectType type,
                      GridPoint position,
                      Map<String, Object> properties,
                      double influenceRadius,
                      PlacementRule rule) {
        this.id = id;
        this.type = type;
        this.position = position;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.influenceRadius = influenceRadius;
        this.rule = rule;
    }

    public String id() {
        return id;
    }

    public ObjectType type() {
        return type;
    }

    public GridPoint position() {
        return position;
    }

    public Map<String, Object> properties() {
        return properties;
    }

    public double influenceRadius() {
        return influenceRadius;
    }

    /** Snapshot of the rule the object was placed under. */
    public PlacementRule rule() {
        return rule;
    }

    @Override
    public String toString() {
        return id + "@" + position;
    }
}
