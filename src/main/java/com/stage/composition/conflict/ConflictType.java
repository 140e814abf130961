package com.stage.composition.conflict;

/**
 * Reasons a property change may clash with existing opinions.
 */
public enum ConflictType {

    /** The prim's source layer belongs to another identity. */
    OWNERSHIP("ownership"),

    /** The property is declared in the prim's originating layer. */
    SOURCE_DEFINITION("source_definition"),

    /** The property already carries a staged, uncommitted override. */
    STAGED_OVERRIDE("staged_override"),

    /** More than one layer in the stack declares the property for this path. */
    MULTI_LAYER_DEFINITION("multi_layer_definition");

    private final String code;

    ConflictType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
