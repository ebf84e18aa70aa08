package org.calista.specopt.ai.spec;

/**
 * Scene-level context. Every field is optional; {@code budget} caps the estimated cost.
 */
public record SceneMetadata(String style, String city, Double budget) {

    public static final SceneMetadata EMPTY = new SceneMetadata(null, null, null);
}
