package com.stage.composition.changelog;

import com.stage.composition.core.model.CommitEntry;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps prim paths recorded in older commits to the paths those prims have now, following
 * every rename in the history.
 *
 * <p>Rename chains collapse ({@code /A -> /B -> /C} maps both {@code /A} and {@code /B} to
 * {@code /C}) and a renamed parent carries its descendants along.</p>
 */
public class PathTranslationRegistry {
    private static final Logger log = LoggerFactory.getLogger(PathTranslationRegistry.class);

    /**
     * One rename as applied to the registry.
     *
     * @param oldPath earliest known path of the renamed prim
     */
    public record RenameEvent(Instant timestamp, String oldPath, String newPath, String commitId) {
    }

    private final Map<String, String> pathMap = new LinkedHashMap<>();
    private final List<RenameEvent> renameChain = new ArrayList<>();

    private PathTranslationRegistry() {
    }

    /**
     * Builds the registry from rename commits, applied oldest first.
     */
    public static PathTranslationRegistry build(Collection<CommitEntry> commits) {
        PathTranslationRegistry registry = new PathTranslationRegistry();
        if (commits == null || commits.isEmpty()) {
            return registry;
        }
        List<CommitEntry> ordered = new ArrayList<>(commits);
        ordered.sort(Comparator.comparing(CommitEntry::timestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
        for (CommitEntry commit : ordered) {
            if (commit.isRename()) {
                registry.apply(commit);
            }
        }
        log.debug("paths.registry.built mappings={} renames={}", registry.pathMap.size(), registry.renameChain.size());
        return registry;
    }

    public static PathTranslationRegistry build(CommitHistory history) {
        return build(history.commits().values());
    }

    private void apply(CommitEntry commit) {
        String oldPath = commit.oldPath();
        String newPath = commit.newPath();
        if (oldPath == null && commit.oldName() != null && commit.referencePath() != null) {
            // older entries carry only names; the reference path is the prim's path after the rename
            String primPath = commit.referencePath();
            String parent = primPath.substring(0, Math.max(primPath.lastIndexOf('/'), 0));
            oldPath = parent + "/" + commit.oldName();
            newPath = primPath;
        }
        if (oldPath == null || newPath == null) {
            log.debug("paths.rename.skipped commitId={} reason=\"no paths\"", commit.id());
            return;
        }

        String earliest = oldPath;
        for (Map.Entry<String, String> mapping : pathMap.entrySet()) {
            if (mapping.getValue().equals(oldPath)) {
                mapping.setValue(newPath);
                earliest = mapping.getKey();
            }
        }
        pathMap.put(oldPath, newPath);
        renameChain.add(new RenameEvent(commit.timestamp(), earliest, newPath, commit.id()));

        String prefix = oldPath + "/";
        for (Map.Entry<String, String> mapping : pathMap.entrySet()) {
            String from = mapping.getKey();
            String to = mapping.getValue();
            if (to.startsWith(prefix)) {
                mapping.setValue(newPath + to.substring(oldPath.length()));
            } else if (from.startsWith(prefix)) {
                mapping.setValue(newPath + from.substring(oldPath.length()));
            }
        }
    }

    /**
     * Current path for a historical one: a direct mapping, else the first renamed ancestor's
     * mapping with the remainder appended, else the path unchanged.
     */
    public String translate(String path) {
        if (path == null) {
            return null;
        }
        String direct = pathMap.get(path);
        if (direct != null) {
            return direct;
        }
        for (Map.Entry<String, String> mapping : pathMap.entrySet()) {
            if (path.startsWith(mapping.getKey() + "/")) {
                return mapping.getValue() + path.substring(mapping.getKey().length());
            }
        }
        return path;
    }

    /**
     * Copy of the prim tree with every path and provenance source path translated.
     */
    public Prim translate(Prim prim) {
        Provenance provenance = prim.getProvenance()
                .map(p -> Provenance.of(p.sourceFile(), translate(p.sourcePath()), p.sourceLayerStatus()))
                .orElse(null);
        String path = translate(prim.getPath());
        Prim copy = Prim.builder(prim)
                .path(path)
                .name(path.substring(path.lastIndexOf('/') + 1))
                .children(List.of())
                .provenance(provenance)
                .build();
        for (Prim child : prim.getChildren()) {
            copy.addChild(translate(child));
        }
        return copy;
    }

    public Map<String, String> getPathMap() {
        return Collections.unmodifiableMap(pathMap);
    }

    public List<RenameEvent> getRenameChain() {
        return Collections.unmodifiableList(renameChain);
    }

    public int size() {
        return pathMap.size();
    }
}
