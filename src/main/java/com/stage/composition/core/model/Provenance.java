package com.stage.composition.core.model;

import java.util.Objects;

/**
 * Where a composed prim's content came from. Only the stage composer stamps provenance;
 * parsed prims never carry it.
 *
 * @param sourceFile        layer file the content was taken from
 * @param sourcePath        path of the prim inside that file, or null when it equals the composed path
 * @param sourceLayerStatus status of the source layer at composition time, or null when unknown
 */
public record Provenance(String sourceFile, String sourcePath, LayerStatus sourceLayerStatus) {

    public Provenance {
        Objects.requireNonNull(sourceFile, "sourceFile is required");
    }

    public static Provenance of(String sourceFile, String sourcePath, LayerStatus status) {
        return new Provenance(sourceFile, sourcePath, status);
    }

    public Provenance withStatus(LayerStatus status) {
        return new Provenance(sourceFile, sourcePath, status);
    }

    /**
     * Source path, falling back to the given composed path when no explicit one was recorded.
     */
    public String sourcePathOr(String composedPath) {
        return sourcePath != null ? sourcePath : composedPath;
    }
}
