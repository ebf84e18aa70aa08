package org.calista.specopt.ai.action;

import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.SpecObject;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * Applies an action index to a spec, producing a new spec.
 *
 * <p>Never throws for an index inside the action space: a template that cannot apply to this
 * spec (slot past the object count, removal from an empty spec, add at capacity, resize of an
 * object without dimensions, material already set) comes back as a degraded no-op.
 * The input spec is never modified.</p>
 */
public final class ActionDecoder {

    static final String DEFAULT_MATERIAL = "standard";

    private final ActionSpace space;
    private final double addedObjectSize;

    public ActionDecoder(ActionSpace space) {
        this(space, 1.0);
    }

    public ActionDecoder(ActionSpace space, double addedObjectSize) {
        this.space = Objects.requireNonNull(space, "space");
        if (!(addedObjectSize > 0.0)) throw new IllegalArgumentException("addedObjectSize must be > 0");
        this.addedObjectSize = addedObjectSize;
    }

    public ActionSpace space() {
        return space;
    }

    public DecodedAction decode(int actionIndex, DesignSpecification spec) {
        Objects.requireNonNull(spec, "spec");
        Action a = space.get(actionIndex);

        return switch (a.kind()) {
            case NO_OP -> new DecodedAction(a, spec, false, null);
            case SET_MATERIAL -> setMaterial(a, spec);
            case RESIZE -> resize(a, spec);
            case REMOVE_OBJECT -> remove(a, spec);
            case ADD_OBJECT -> add(a, spec);
        };
    }

    private DecodedAction setMaterial(Action a, DesignSpecification spec) {
        if (a.slot() >= spec.objectCount()) return degraded(a, spec, "slot " + a.slot() + " is empty");
        SpecObject o = spec.object(a.slot());
        if (a.material().equals(o.material())) return degraded(a, spec, "material unchanged");
        return new DecodedAction(a, spec.withObject(a.slot(), o.withMaterial(a.material())), false, null);
    }

    private DecodedAction resize(Action a, DesignSpecification spec) {
        if (a.slot() >= spec.objectCount()) return degraded(a, spec, "slot " + a.slot() + " is empty");
        SpecObject o = spec.object(a.slot());
        if (o.dimensions().isEmpty()) return degraded(a, spec, "object has no dimensions");
        return new DecodedAction(a, spec.withObject(a.slot(), o.scaled(a.scale())), false, null);
    }

    private DecodedAction remove(Action a, DesignSpecification spec) {
        if (a.slot() >= spec.objectCount()) return degraded(a, spec, "slot " + a.slot() + " is empty");
        ArrayList<SpecObject> objects = new ArrayList<>(spec.objects());
        objects.remove(a.slot());
        return new DecodedAction(a, spec.withObjects(objects), false, null);
    }

    private DecodedAction add(Action a, DesignSpecification spec) {
        if (spec.objectCount() >= space.maxSlots()) return degraded(a, spec, "spec at capacity");

        String type = a.objectType();
        int n = 1;
        while (spec.containsId(type + "_" + n)) n++;

        SpecObject added = new SpecObject(
                type + "_" + n,
                type,
                DEFAULT_MATERIAL,
                null,
                Map.of("height", addedObjectSize, "length", addedObjectSize, "width", addedObjectSize),
                null);

        ArrayList<SpecObject> objects = new ArrayList<>(spec.objects());
        objects.add(added);
        return new DecodedAction(a, spec.withObjects(objects), false, null);
    }

    private static DecodedAction degraded(Action a, DesignSpecification spec, String why) {
        return new DecodedAction(a, spec, true, why);
    }
}
