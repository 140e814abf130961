package com.stage.composition.parse;

import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import com.stage.composition.core.model.SourceText;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of parsing one layer text: the exact source generation and its root prims.
 * Spans on the prims are valid against {@link #source()} only.
 */
public record ParsedDocument(SourceText source, List<Prim> roots) {

    public ParsedDocument {
        Objects.requireNonNull(source, "source is required");
        roots = roots != null ? List.copyOf(roots) : List.of();
    }

    public Optional<Prim> find(String path) {
        return PrimTree.findByPath(roots, path);
    }

    public Optional<Prim> findByName(String name) {
        return PrimTree.findByName(roots, name);
    }

    public List<String> paths() {
        return PrimTree.collectPaths(roots);
    }

    public boolean isEmpty() {
        return roots.isEmpty();
    }

    /**
     * The document's default prim: its first root.
     */
    public Optional<Prim> defaultPrim() {
        return roots.isEmpty() ? Optional.empty() : Optional.of(roots.get(0));
    }
}
