package com.stage.composition.merge;

import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Specifier;
import com.stage.composition.parse.PrimParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composes two prim trees, the override tree being the stronger opinion.
 *
 * <p>Prims are matched by path. For a matched prim the override's properties win key by key,
 * its reference and payload arcs replace the base ones, and its provenance stamp, if any,
 * replaces the base one. A merged prim therefore carries the provenance of its strongest
 * opinion, and ownership filtering applies to that layer's owner. Override prims with no
 * base counterpart are added as definitions. Inputs are never mutated.</p>
 */
public class LayerMerger {
    private static final Logger log = LoggerFactory.getLogger(LayerMerger.class);

    private final PrimParser parser;

    public LayerMerger() {
        this(new PrimParser());
    }

    public LayerMerger(PrimParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
    }

    /**
     * Parses both texts and merges them.
     *
     * @throws com.stage.composition.core.MalformedSourceException if either text has unbalanced braces
     */
    public List<Prim> mergeLayers(String baseText, String overrideText) {
        return merge(parser.parse(baseText).roots(), parser.parse(overrideText).roots());
    }

    public List<Prim> merge(List<Prim> base, List<Prim> override) {
        Map<String, Prim> byPath = new LinkedHashMap<>();
        flatten(base, byPath);
        int[] counts = new int[2];
        applyOverrides(override, byPath, counts);

        List<Prim> roots = new ArrayList<>();
        for (Prim prim : byPath.values()) {
            String parentPath = prim.getParentPath();
            Prim parent = parentPath != null ? byPath.get(parentPath) : null;
            if (parent != null) {
                parent.addChild(prim);
            } else {
                if (parentPath != null) {
                    log.debug("merge.orphan path={} missingParent={}", prim.getPath(), parentPath);
                }
                roots.add(prim);
            }
        }
        log.debug("merge.completed merged={} added={} roots={}", counts[0], counts[1], roots.size());
        return roots;
    }

    private static void flatten(List<Prim> prims, Map<String, Prim> byPath) {
        for (Prim prim : prims) {
            byPath.put(prim.getPath(), prim.shallowCopy());
            flatten(prim.getChildren(), byPath);
        }
    }

    private static void applyOverrides(List<Prim> prims, Map<String, Prim> byPath, int[] counts) {
        for (Prim source : prims) {
            Prim existing = byPath.get(source.getPath());
            if (existing != null) {
                existing.getProperties().putAll(source.getProperties());
                if (source.getReference() != null) {
                    existing.setReference(source.getReference());
                }
                if (source.getPayload() != null) {
                    existing.setPayload(source.getPayload());
                }
                source.getProvenance().ifPresent(existing::setProvenance);
                counts[0]++;
            } else {
                Prim added = source.shallowCopy();
                added.setSpecifier(Specifier.DEFINE);
                byPath.put(added.getPath(), added);
                counts[1]++;
            }
            applyOverrides(source.getChildren(), byPath, counts);
        }
    }
}
