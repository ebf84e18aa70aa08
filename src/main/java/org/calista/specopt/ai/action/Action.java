package org.calista.specopt.ai.action;

import java.util.Objects;

/**
 * One concrete action template: kind + typed payload.
 * Unused payload fields are {@code -1} / {@code null} / {@code 1.0}.
 */
public record Action(ActionKind kind, int slot, String material, double scale, String objectType) {

    public static final Action NO_OP = new Action(ActionKind.NO_OP, -1, null, 1.0, null);

    public Action {
        Objects.requireNonNull(kind, "kind");
    }

    public static Action setMaterial(int slot, String material) {
        return new Action(ActionKind.SET_MATERIAL, slot, Objects.requireNonNull(material, "material"), 1.0, null);
    }

    public static Action resize(int slot, double scale) {
        if (!(scale > 0.0) || !Double.isFinite(scale)) throw new IllegalArgumentException("scale must be > 0: " + scale);
        return new Action(ActionKind.RESIZE, slot, null, scale, null);
    }

    public static Action remove(int slot) {
        return new Action(ActionKind.REMOVE_OBJECT, slot, null, 1.0, null);
    }

    public static Action add(String objectType) {
        return new Action(ActionKind.ADD_OBJECT, -1, null, 1.0, Objects.requireNonNull(objectType, "objectType"));
    }

    public String describe() {
        return switch (kind) {
            case NO_OP -> "no_op";
            case SET_MATERIAL -> "set_material[" + slot + "]=" + material;
            case RESIZE -> "resize[" + slot + "]x" + scale;
            case ADD_OBJECT -> "add:" + objectType;
            case REMOVE_OBJECT -> "remove[" + slot + "]";
        };
    }
}
