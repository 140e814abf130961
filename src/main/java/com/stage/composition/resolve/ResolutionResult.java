package com.stage.composition.resolve;

import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;

import java.util.List;
import java.util.Optional;

/**
 * Composed roots plus the non-fatal warnings raised while producing them
 * (unloaded reference targets, missing target prims, malformed layers).
 */
public record ResolutionResult(List<Prim> roots, List<String> warnings) {

    public ResolutionResult {
        roots = roots != null ? List.copyOf(roots) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ResolutionResult empty() {
        return new ResolutionResult(List.of(), List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public Optional<Prim> find(String path) {
        return PrimTree.findByPath(roots, path);
    }
}
