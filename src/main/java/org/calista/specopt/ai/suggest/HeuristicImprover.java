package org.calista.specopt.ai.suggest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.env.HardConstraints;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.SpecObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * HeuristicImprover — rule-based spec edits that need no trained model.
 *
 * <p>Rule groups, applied in this order under {@link Focus#AUTO}:</p>
 * <ul>
 *   <li>materials: upgrade table, unknown materials become {@code premium_<m>}; cost x1.15</li>
 *   <li>layout: widen porches, enlarge garages, add windows; cost x1.08</li>
 *   <li>colours: harmony table for a few dull defaults</li>
 * </ul>
 * AUTO charges a further x1.1 once anything changed. A group's cost factor is charged together with
 * its first accepted edit. Costs are truncated to whole units.
 *
 * <p>Every candidate edit is scored and kept only if the score does not decrease and it introduces no
 * hard-constraint violation, so the returned spec never scores below the input.</p>
 */
public final class HeuristicImprover {
    private static final Logger log = LogManager.getLogger(HeuristicImprover.class);

    public enum Focus {
        AUTO,
        MATERIALS,
        LAYOUT,
        COLORS
    }

    /** Improved spec, its score and the labels of accepted / rejected edits. */
    public record Result(DesignSpecification spec, double score, List<String> applied, List<String> rejected) {
        public Result {
            applied = List.copyOf(applied);
            rejected = List.copyOf(rejected);
        }
    }

    static final String PREMIUM_PREFIX = "premium_";

    private static final Map<String, String> MATERIAL_UPGRADES = Map.ofEntries(
            Map.entry("wood_basic", "wood_oak"),
            Map.entry("wood_oak", "wood_walnut"),
            Map.entry("wood_walnut", "wood_teak"),
            Map.entry("fabric", "leather_genuine"),
            Map.entry("plastic", "metal_aluminum"),
            Map.entry("steel", "titanium_alloy"),
            Map.entry("paper", "canvas"),
            Map.entry("concrete", "reinforced_concrete"),
            Map.entry("siding", "brick_premium"),
            Map.entry("shingle_asphalt", "metal_standing_seam"),
            Map.entry("wood_deck", "composite_deck"),
            Map.entry("glass_double_pane", "glass_triple_pane")
    );

    private static final Map<String, String> COLOR_HARMONY = Map.of(
            "#808080", "#2C3E50",
            "#D2B48C", "#34495E",
            "#2F4F4F", "#1A252F",
            "#87CEEB", "#3498DB"
    );

    private static final double MATERIAL_COST_FACTOR = 1.15;
    private static final double LAYOUT_COST_FACTOR = 1.08;
    private static final double AUTO_COST_FACTOR = 1.1;

    private final SpecScorer scorer;
    private final HardConstraints constraints;

    public HeuristicImprover(SpecScorer scorer, HardConstraints constraints) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    public Result improve(DesignSpecification spec, String prompt) {
        return improve(spec, prompt, Focus.AUTO);
    }

    public Result improve(DesignSpecification spec, String prompt, Focus focus) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(focus, "focus");
        final String p = prompt == null ? "" : prompt;

        Walk w = new Walk(p, spec.validate());

        if (focus == Focus.AUTO || focus == Focus.MATERIALS) w.group(materialEdits(w.current), MATERIAL_COST_FACTOR);
        if (focus == Focus.AUTO || focus == Focus.LAYOUT) w.group(layoutEdits(w.current), LAYOUT_COST_FACTOR);
        if (focus == Focus.AUTO || focus == Focus.COLORS) w.group(colorEdits(w.current), 1.0);
        if (focus == Focus.AUTO && !w.applied.isEmpty() && w.current.estimatedCost() != null) {
            w.tryEdit("cost x" + AUTO_COST_FACTOR, withCostFactor(w.current, AUTO_COST_FACTOR));
        }

        log.debug("heuristic {}: {} applied, {} rejected, score {} -> {}",
                focus, w.applied.size(), w.rejected.size(), w.initialScore, w.score);
        return new Result(w.current, w.score, w.applied, w.rejected);
    }

    /** Next material in the upgrade chain, or empty when there is nothing to upgrade. */
    public static Optional<String> upgradeMaterial(String material) {
        if (material == null || material.isBlank()) return Optional.empty();
        String up = MATERIAL_UPGRADES.get(material);
        if (up != null) return Optional.of(up);
        if (material.startsWith(PREMIUM_PREFIX)) return Optional.empty();
        return Optional.of(PREMIUM_PREFIX + material);
    }

    // ---------------------------------------------------------------------
    // Rule groups: one labelled edit per object, applied to whatever the spec is at that point
    // ---------------------------------------------------------------------

    private record Edit(String label, UnaryOperator<DesignSpecification> apply) {
    }

    private static List<Edit> materialEdits(DesignSpecification spec) {
        ArrayList<Edit> out = new ArrayList<>();
        for (int i = 0; i < spec.objectCount(); i++) {
            SpecObject o = spec.object(i);
            Optional<String> up = upgradeMaterial(o.material());
            if (up.isEmpty()) continue;
            final String id = o.id();
            final String to = up.get();
            out.add(new Edit(id + ".material " + o.material() + " -> " + to,
                    s -> replace(s, id, x -> x.withMaterial(to))));
        }
        return out;
    }

    private static List<Edit> layoutEdits(DesignSpecification spec) {
        ArrayList<Edit> out = new ArrayList<>();
        for (SpecObject o : spec.objects()) {
            final String id = o.id();
            switch (o.type().toLowerCase(Locale.ROOT)) {
                case "porch" -> {
                    if (o.dimensions().containsKey("width") || o.dimensions().containsKey("length")) {
                        out.add(new Edit(id + " widen porch", s -> replace(s, id, HeuristicImprover::widenPorch)));
                    }
                }
                case "garage" -> {
                    if (o.dimensions().containsKey("width") && o.dimensions().containsKey("length")) {
                        out.add(new Edit(id + " enlarge garage", s -> replace(s, id, HeuristicImprover::enlargeGarage)));
                    }
                }
                case "window" -> {
                    if (o.count() != null && o.count() < 16) {
                        out.add(new Edit(id + " more windows", s -> replace(s, id, x -> x.withCount(Math.min(x.count() + 4, 16)))));
                    }
                }
                default -> {
                }
            }
        }
        return out;
    }

    private static List<Edit> colorEdits(DesignSpecification spec) {
        ArrayList<Edit> out = new ArrayList<>();
        for (SpecObject o : spec.objects()) {
            if (o.color() == null) continue;
            String to = COLOR_HARMONY.get(o.color().toUpperCase(Locale.ROOT));
            if (to == null) continue;
            final String id = o.id();
            out.add(new Edit(id + ".color " + o.color() + " -> " + to, s -> replace(s, id, x -> x.withColor(to))));
        }
        return out;
    }

    private static SpecObject widenPorch(SpecObject o) {
        TreeMap<String, Double> d = new TreeMap<>(o.dimensions());
        d.computeIfPresent("width", (k, v) -> Math.min(v * 1.25, 30.0));
        d.computeIfPresent("length", (k, v) -> Math.max(v * 1.33, 4.0));
        return o.withDimensions(d);
    }

    private static SpecObject enlargeGarage(SpecObject o) {
        TreeMap<String, Double> d = new TreeMap<>(o.dimensions());
        d.computeIfPresent("width", (k, v) -> Math.max(v + 2.0, 8.0));
        d.computeIfPresent("length", (k, v) -> Math.max(v + 2.0, 8.0));
        return o.withDimensions(d);
    }

    private static DesignSpecification replace(DesignSpecification s, String id, UnaryOperator<SpecObject> f) {
        for (int i = 0; i < s.objectCount(); i++) {
            if (s.object(i).id().equals(id)) return s.withObject(i, f.apply(s.object(i)));
        }
        return s;
    }

    private static DesignSpecification withCostFactor(DesignSpecification s, double factor) {
        if (s.estimatedCost() == null) return s;
        return s.withEstimatedCost(Math.floor(s.estimatedCost() * factor));
    }

    // ---------------------------------------------------------------------

    /** Greedy accept/reject walk over candidate edits. */
    private final class Walk {
        final String prompt;
        final double initialScore;
        final ArrayList<String> applied = new ArrayList<>();
        final ArrayList<String> rejected = new ArrayList<>();
        DesignSpecification current;
        double score;

        Walk(String prompt, DesignSpecification start) {
            this.prompt = prompt;
            this.current = start;
            this.score = scorer.score(prompt, start);
            this.initialScore = score;
        }

        void group(List<Edit> edits, double costFactor) {
            boolean charged = costFactor == 1.0;
            for (Edit e : edits) {
                DesignSpecification cand = e.apply().apply(current);
                String label = e.label();
                boolean carriesCost = !charged && cand.estimatedCost() != null;
                if (carriesCost) {
                    cand = withCostFactor(cand, costFactor);
                    label = label + " (cost x" + costFactor + ")";
                }
                if (tryEdit(label, cand) && carriesCost) charged = true;
            }
        }

        boolean tryEdit(String label, DesignSpecification cand) {
            if (cand.equals(current)) return false;
            Optional<String> violation = constraints.introduced(current, cand);
            if (violation.isPresent()) {
                rejected.add(label + " [" + violation.get() + "]");
                return false;
            }
            double s = scorer.score(prompt, cand);
            if (s < score) {
                rejected.add(label + " [score " + s + " < " + score + "]");
                return false;
            }
            current = cand;
            score = s;
            applied.add(label);
            return true;
        }
    }
}
