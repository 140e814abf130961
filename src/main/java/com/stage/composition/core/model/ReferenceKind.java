package com.stage.composition.core.model;

/**
 * Kind of composition arc a prim declares toward another layer.
 */
public enum ReferenceKind {
    REFERENCE("references"),
    PAYLOAD("payload");

    private final String keyword;

    ReferenceKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Metadata keyword used in documents.
     */
    public String keyword() {
        return keyword;
    }
}
