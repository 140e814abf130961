package com.stage.composition.layer;

/**
 * Kind of mutation applied to a {@link LayerStack}.
 */
public enum LayerChangeType {

    /** A layer was appended to the stack. */
    ADDED,

    /** A layer was removed from the stack. */
    REMOVED,

    /** Layer order changed. */
    REORDERED,

    /** A layer moved one step along the status workflow. */
    STATUS_CHANGED,

    /** Visibility or ownership of a layer changed. */
    UPDATED
}
