package com.stage.composition.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Depth-first lookups over a forest of prims.
 */
public final class PrimTree {

    private PrimTree() {
    }

    public static Optional<Prim> findByPath(List<Prim> roots, String path) {
        if (path == null) {
            return Optional.empty();
        }
        for (Prim prim : roots) {
            if (prim.getPath().equals(path)) {
                return Optional.of(prim);
            }
            if (path.startsWith(prim.getPath() + "/")) {
                Optional<Prim> found = findByPath(prim.getChildren(), path);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * First prim, in document order, whose bare name matches.
     */
    public static Optional<Prim> findByName(List<Prim> roots, String name) {
        for (Prim prim : roots) {
            if (prim.getName().equals(name)) {
                return Optional.of(prim);
            }
            Optional<Prim> found = findByName(prim.getChildren(), name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Looks a prim up by path, falling back to the first prim carrying the path's last segment.
     */
    public static Optional<Prim> findByPathOrName(List<Prim> roots, String path) {
        Optional<Prim> byPath = findByPath(roots, path);
        if (byPath.isPresent() || path == null) {
            return byPath;
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.isEmpty() ? Optional.empty() : findByName(roots, name);
    }

    public static List<String> collectPaths(List<Prim> roots) {
        List<String> paths = new ArrayList<>();
        walk(roots, prim -> paths.add(prim.getPath()));
        return paths;
    }

    public static boolean containsPath(List<Prim> roots, String path) {
        return findByPath(roots, path).isPresent();
    }

    public static int count(List<Prim> roots) {
        int[] total = {0};
        walk(roots, prim -> total[0]++);
        return total[0];
    }

    /**
     * Visits every prim in pre-order.
     */
    public static void walk(List<Prim> roots, Consumer<Prim> visitor) {
        for (Prim prim : roots) {
            visitor.accept(prim);
            walk(prim.getChildren(), visitor);
        }
    }

    public static List<Prim> deepCopy(List<Prim> roots) {
        List<Prim> copy = new ArrayList<>(roots.size());
        for (Prim prim : roots) {
            copy.add(prim.deepCopy());
        }
        return copy;
    }
}
