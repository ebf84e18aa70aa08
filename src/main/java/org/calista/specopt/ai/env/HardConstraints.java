package org.calista.specopt.ai.env;

import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.SpecObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Hard feasibility limits on a design spec.
 *
 * <p>{@link #violations} reports every broken limit under a stable key ({@code objects},
 * {@code dim:<id>.<name>:max}, {@code dim:<id>.<name>:min}, {@code budget}); {@link #check}
 * returns the first of them. Limits:</p>
 * <ul>
 *   <li>every dimension within [minDimension, maxDimension]</li>
 *   <li>object count at most maxObjects</li>
 *   <li>estimated cost at most the scene budget, when both are present</li>
 * </ul>
 */
public final class HardConstraints {

    private final double minDimension;
    private final double maxDimension;
    private final int maxObjects;

    public HardConstraints(double minDimension, double maxDimension, int maxObjects) {
        if (!(minDimension > 0.0) || !(maxDimension > minDimension)) {
            throw new IllegalArgumentException("require 0 < minDimension < maxDimension");
        }
        if (maxObjects < 1) throw new IllegalArgumentException("maxObjects must be >= 1");
        this.minDimension = minDimension;
        this.maxDimension = maxDimension;
        this.maxObjects = maxObjects;
    }

    public static HardConstraints defaults() {
        return new HardConstraints(0.05, 50.0, 16);
    }

    public double minDimension() {
        return minDimension;
    }

    public double maxDimension() {
        return maxDimension;
    }

    public int maxObjects() {
        return maxObjects;
    }

    /** Broken limits keyed by limit, in check order; empty when the spec is feasible. */
    public Map<String, String> violations(DesignSpecification spec) {
        Map<String, String> out = new LinkedHashMap<>();
        if (spec.objectCount() > maxObjects) {
            out.put("objects", "object count " + spec.objectCount() + " exceeds " + maxObjects);
        }
        for (SpecObject o : spec.objects()) {
            for (Map.Entry<String, Double> d : o.dimensions().entrySet()) {
                double v = d.getValue();
                String key = "dim:" + o.id() + "." + d.getKey();
                if (v > maxDimension) out.put(key + ":max", o.id() + "." + d.getKey() + "=" + v + " exceeds " + maxDimension);
                if (v < minDimension) out.put(key + ":min", o.id() + "." + d.getKey() + "=" + v + " below " + minDimension);
            }
        }
        Double budget = spec.scene().budget();
        Double cost = spec.estimatedCost();
        if (budget != null && cost != null && cost > budget) {
            out.put("budget", "estimated cost " + cost + " exceeds budget " + budget);
        }
        return out;
    }

    public Optional<String> check(DesignSpecification spec) {
        return violations(spec).values().stream().findFirst();
    }

    /**
     * First violation introduced by moving from {@code before} to {@code after}. A limit that
     * {@code before} already broke is not blamed on the edit; any other broken limit is.
     */
    public Optional<String> introduced(DesignSpecification before, DesignSpecification after) {
        Map<String, String> now = violations(after);
        if (now.isEmpty()) return Optional.empty();
        Map<String, String> was = violations(before);
        for (Map.Entry<String, String> v : now.entrySet()) {
            if (!was.containsKey(v.getKey())) return Optional.of(v.getValue());
        }
        return Optional.empty();
    }
}
