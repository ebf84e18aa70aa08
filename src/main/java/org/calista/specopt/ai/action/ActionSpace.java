package org.calista.specopt.ai.action;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed enumeration of action templates, built once.
 *
 * <p>Layout: index 0 is NO_OP; then for each slot {@code i < maxSlots}: one SET_MATERIAL per palette
 * material, one RESIZE per scale factor, one REMOVE; then one ADD per addable type.
 * The size never depends on the spec being edited.</p>
 */
public final class ActionSpace {

    private final int maxSlots;
    private final List<String> materials;
    private final List<Double> scaleFactors;
    private final List<String> addableTypes;
    private final List<Action> actions;

    public ActionSpace(int maxSlots, List<String> materials, List<Double> scaleFactors, List<String> addableTypes) {
        if (maxSlots < 1) throw new IllegalArgumentException("maxSlots must be >= 1");
        this.maxSlots = maxSlots;
        this.materials = List.copyOf(Objects.requireNonNull(materials, "materials"));
        this.scaleFactors = List.copyOf(Objects.requireNonNull(scaleFactors, "scaleFactors"));
        this.addableTypes = List.copyOf(Objects.requireNonNull(addableTypes, "addableTypes"));

        ArrayList<Action> all = new ArrayList<>();
        all.add(Action.NO_OP);
        for (int slot = 0; slot < maxSlots; slot++) {
            for (String m : this.materials) all.add(Action.setMaterial(slot, m));
            for (double f : this.scaleFactors) all.add(Action.resize(slot, f));
            all.add(Action.remove(slot));
        }
        for (String t : this.addableTypes) all.add(Action.add(t));
        this.actions = Collections.unmodifiableList(all);
    }

    public int size() {
        return actions.size();
    }

    public int maxSlots() {
        return maxSlots;
    }

    public List<String> materials() {
        return materials;
    }

    public List<String> addableTypes() {
        return addableTypes;
    }

    /**
     * @throws IllegalArgumentException for indices outside {@code [0, size())}
     */
    public Action get(int index) {
        if (index < 0 || index >= actions.size()) {
            throw new IllegalArgumentException("action index " + index + " outside [0, " + actions.size() + ")");
        }
        return actions.get(index);
    }

    public int noOpIndex() {
        return 0;
    }

    /** Index of an equal action, or -1. */
    public int indexOf(Action action) {
        return actions.indexOf(action);
    }

    public List<Action> all() {
        return actions;
    }
}
