package org.calista.specopt.ai.encode;

import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.SceneMetadata;
import org.calista.specopt.ai.spec.SpecObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a (prompt, spec) pair into namespaced feature tokens.
 *
 * <p>Prompt: {@code p:<word>} (lowercased letters/digits, the prompt is never parsed beyond that).
 * Objects, in declared order: slot-qualified tokens ({@code o3:material:oak}) so a policy can
 * tell slots apart, plus global ones ({@code material:oak}). Numbers become log2 buckets.</p>
 */
public final class SpecTokenizer {

    private final int maxPromptTokens;
    private final int maxSlots;

    public SpecTokenizer(int maxPromptTokens, int maxSlots) {
        if (maxPromptTokens < 1) throw new IllegalArgumentException("maxPromptTokens must be >= 1");
        if (maxSlots < 1) throw new IllegalArgumentException("maxSlots must be >= 1");
        this.maxPromptTokens = maxPromptTokens;
        this.maxSlots = maxSlots;
    }

    public List<String> promptTokens(String prompt) {
        if (prompt == null || prompt.isBlank()) return List.of();
        String s = prompt.toLowerCase(Locale.ROOT);

        StringBuilder b = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            b.append(Character.isLetterOrDigit(c) ? c : ' ');
        }

        ArrayList<String> out = new ArrayList<>();
        for (String p : b.toString().trim().split("\\s+")) {
            if (p.isEmpty()) continue;
            out.add("p:" + p);
            if (out.size() >= maxPromptTokens) break;
        }
        return out;
    }

    public List<String> specTokens(DesignSpecification spec) {
        ArrayList<String> out = new ArrayList<>(16 + spec.objectCount() * 10);
        out.add("objects:" + spec.objectCount());
        if (spec.designType() != null) out.add("design:" + norm(spec.designType()));

        List<SpecObject> objects = spec.objects();
        for (int i = 0; i < objects.size(); i++) {
            SpecObject o = objects.get(i);
            String type = norm(o.type());
            String slot = i < maxSlots ? "o" + i + ":" : null;

            out.add("type:" + type);
            if (slot != null) out.add(slot + "type:" + type);

            String material = o.hasMaterial() ? norm(o.material()) : "none";
            out.add("material:" + material);
            out.add(type + ":material:" + material);
            if (slot != null) out.add(slot + "material:" + material);

            if (o.color() != null) {
                out.add("color:" + norm(o.color()));
                if (slot != null) out.add(slot + "color:" + norm(o.color()));
            }
            for (Map.Entry<String, Double> d : o.dimensions().entrySet()) {
                String dt = "dim:" + norm(d.getKey()) + ":" + bucket(d.getValue());
                out.add(type + ":" + dt);
                if (slot != null) out.add(slot + dt);
            }
            if (o.count() != null) out.add(type + ":count:" + bucket(o.count()));
        }

        SceneMetadata scene = spec.scene();
        if (scene.style() != null) out.add("style:" + norm(scene.style()));
        if (scene.city() != null) out.add("city:" + norm(scene.city()));
        if (spec.estimatedCost() != null) out.add("cost:" + bucket(spec.estimatedCost()));
        if (scene.budget() != null && spec.estimatedCost() != null) {
            out.add(spec.estimatedCost() <= scene.budget() ? "budget:within" : "budget:over");
        }
        return out;
    }

    static String norm(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }

    /** floor(log2(v)) for v > 0, "z" otherwise. */
    static String bucket(double v) {
        if (!(v > 0.0) || !Double.isFinite(v)) return "z";
        return Integer.toString(Math.getExponent(v));
    }
}
