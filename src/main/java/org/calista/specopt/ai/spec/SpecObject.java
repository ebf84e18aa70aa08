package org.calista.specopt.ai.spec;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One object of a design spec. Immutable: edits return a new instance.
 *
 * <p>{@code dimensions} are kept sorted by name so encoding never depends on insertion order.
 * {@code color} and {@code count} are optional (nullable).</p>
 */
public record SpecObject(String id,
                         String type,
                         String material,
                         String color,
                         Map<String, Double> dimensions,
                         Integer count) {

    public SpecObject {
        dimensions = (dimensions == null || dimensions.isEmpty())
                ? Map.of()
                : Collections.unmodifiableSortedMap(new TreeMap<>(dimensions));
    }

    public static SpecObject of(String id, String type, String material) {
        return new SpecObject(id, type, material, null, Map.of(), null);
    }

    public SpecObject withMaterial(String newMaterial) {
        return new SpecObject(id, type, newMaterial, color, dimensions, count);
    }

    public SpecObject withColor(String newColor) {
        return new SpecObject(id, type, material, newColor, dimensions, count);
    }

    public SpecObject withDimensions(Map<String, Double> newDimensions) {
        return new SpecObject(id, type, material, color, newDimensions, count);
    }

    public SpecObject withCount(Integer newCount) {
        return new SpecObject(id, type, material, color, dimensions, newCount);
    }

    /** Multiplies every dimension by {@code factor}. */
    public SpecObject scaled(double factor) {
        if (dimensions.isEmpty()) return this;
        TreeMap<String, Double> out = new TreeMap<>();
        for (Map.Entry<String, Double> e : dimensions.entrySet()) out.put(e.getKey(), e.getValue() * factor);
        return withDimensions(out);
    }

    public double dimension(String name, double fallback) {
        Double v = dimensions.get(Objects.requireNonNull(name, "name"));
        return v == null ? fallback : v;
    }

    public boolean hasMaterial() {
        return material != null && !material.isBlank();
    }
}
