package org.calista.specopt.ai.action;

/**
 * Edit templates of the action space.
 */
public enum ActionKind {
    /** Policy signals convergence; ends the episode. */
    NO_OP,
    SET_MATERIAL,
    RESIZE,
    ADD_OBJECT,
    REMOVE_OBJECT
}
