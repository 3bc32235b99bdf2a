package com.flowmable.spd;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emitting-surface area of a primary, keyed by the suffix of its name.
 * <p>
 * When several suffixes match, the longest one wins.
 */
public final class SurfaceAreaLookup {

    /** Areas in mm² for the emitter packages used so far. */
    public static final Map<String, Double> DEFAULT_AREAS = Map.of(
            "EP", 2.0 * 2.0,
            "SR", 1.2 * 1.5,
            "21", 2.0 * 1.0  // the "LA21"
    );

    private final Map<String, Double> areasBySuffix;

    public SurfaceAreaLookup(Map<String, Double> areasBySuffix) {
        this.areasBySuffix = new LinkedHashMap<>(areasBySuffix);
    }

    public static SurfaceAreaLookup defaults() {
        return new SurfaceAreaLookup(DEFAULT_AREAS);
    }

    /**
     * @throws ConfigurationException if no configured suffix matches the name
     */
    public double areaFor(String primaryName) {
        String best = null;
        for (String suffix : areasBySuffix.keySet()) {
            if (primaryName.endsWith(suffix) && (best == null || suffix.length() > best.length())) {
                best = suffix;
            }
        }
        if (best == null) {
            throw new ConfigurationException("Need the surface area for primary " + primaryName
                    + " (known suffixes: " + areasBySuffix.keySet() + ")");
        }
        return areasBySuffix.get(best);
    }
}
