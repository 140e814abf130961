package com.stage.composition.resolve;

import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.model.Layer;
import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import com.stage.composition.core.model.Provenance;
import com.stage.composition.core.model.Specifier;
import com.stage.composition.layer.LayerStack;
import com.stage.composition.merge.LayerMerger;
import com.stage.composition.parse.PrimParser;
import com.stage.composition.security.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Produces the composed tree of a {@link Stage}: stages the layer stack, filters what the
 * acting identity may see, resolves references and caches the result in the stage.
 */
public class StageComposer {
    private static final Logger log = LoggerFactory.getLogger(StageComposer.class);

    private final PrimParser parser;
    private final LayerMerger merger;
    private final ReferenceResolver resolver;
    private final String changelogLayer;

    public StageComposer(PrimParser parser, LayerMerger merger, ReferenceResolver resolver, String changelogLayer) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.merger = Objects.requireNonNull(merger, "merger is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.changelogLayer = changelogLayer;
    }

    /**
     * Composed tree for the given actor, from the stage cache when still valid.
     */
    public ResolutionResult compose(Stage stage, StageContext context) {
        Optional<ResolutionResult> cached = stage.cachedComposition(context);
        if (cached.isPresent()) {
            log.debug("stage.recompose.cached roots={}", cached.get().roots().size());
            return cached.get();
        }
        List<Prim> visible = filterVisible(stage.getStagedPrims(), stage.getLayerStack(), context);
        ResolutionResult result = resolver.resolve(visible, stage.getLayerStack(), stage.getTexts());
        stage.cacheComposition(context, result);
        log.info("stage.recompose.completed roots={} hidden={} warnings={}",
                result.roots().size(), stage.getStagedPrims().size() - visible.size(), result.warnings().size());
        return result;
    }

    /**
     * Drops staged roots whose provenance layer is owned by someone other than the actor.
     * Privileged actors see everything.
     */
    public List<Prim> filterVisible(List<Prim> staged, LayerStack stack, StageContext context) {
        if (context.isPrivileged()) {
            return new ArrayList<>(staged);
        }
        List<Prim> visible = new ArrayList<>();
        for (Prim prim : staged) {
            Optional<Layer> layer = prim.getProvenance()
                    .flatMap(p -> stack.find(p.sourceFile()));
            if (layer.isPresent() && context.isHiddenOwner(layer.get().getOwner())) {
                log.debug("stage.filter.hidden path={} owner={}", prim.getPath(), layer.get().getOwner());
                continue;
            }
            visible.add(prim);
        }
        return visible;
    }

    /**
     * Rebuilds the staged prims by folding every visible, loaded layer through the merger in
     * stack order, each layer's prims stamped with that layer's provenance.
     * The change-log layer is never staged.
     *
     * @return warnings for layers that could not be parsed
     */
    public List<String> stageFromStack(Stage stage) {
        List<String> warnings = new ArrayList<>();
        List<Prim> staged = new ArrayList<>();
        for (Layer layer : stage.getLayerStack().visibleLayers()) {
            String file = layer.getFilePath();
            if (file.equals(changelogLayer)) {
                continue;
            }
            Optional<String> text = stage.getText(file);
            if (text.isEmpty()) {
                warnings.add(warn("Layer '" + file + "' is in the stack but not loaded"));
                continue;
            }
            List<Prim> roots;
            try {
                roots = parser.parse(text.get()).roots();
            } catch (MalformedSourceException e) {
                warnings.add(warn("Layer '" + file + "' skipped: " + e.getMessage()));
                continue;
            }
            List<Prim> stamped = new ArrayList<>();
            for (Prim root : roots) {
                Prim copy = root.deepCopy();
                stamp(copy, file, layer.getStatus());
                stamped.add(copy);
            }
            staged = merger.merge(staged, stamped);
        }
        stage.setStagedPrims(staged);
        log.info("stage.staged layers={} roots={}", stage.getLayerStack().visibleLayers().size(), staged.size());
        return warnings;
    }

    /**
     * Re-reads one layer and merges its prims into the staged tree, then recomposes.
     *
     * @param primPath when given, only this prim of the layer is merged and nothing is pruned
     */
    public ResolutionResult refresh(Stage stage, String filePath, String primPath, StageContext context) {
        Optional<String> text = stage.getText(filePath);
        if (text.isEmpty()) {
            warn("Refresh skipped, file not loaded: " + filePath);
            return compose(stage, context);
        }
        List<Prim> fresh;
        try {
            fresh = parser.parse(text.get()).roots();
        } catch (MalformedSourceException e) {
            warn("Refresh skipped, layer '" + filePath + "' is malformed: " + e.getMessage());
            return compose(stage, context);
        }
        if (primPath != null) {
            Optional<Prim> target = PrimTree.findByPath(fresh, primPath);
            if (target.isEmpty()) {
                warn("Refresh skipped, prim " + primPath + " not found in " + filePath);
                return compose(stage, context);
            }
            fresh = List.of(target.get());
        }

        LayerStatus status = resolver.statusOf(stage.getLayerStack(), filePath);
        List<Prim> staged = PrimTree.deepCopy(stage.getStagedPrims());
        List<Prim> siblings = staged;
        if (primPath != null && fresh.get(0).getParentPath() != null) {
            siblings = PrimTree.findByPath(staged, fresh.get(0).getParentPath())
                    .map(Prim::getChildren)
                    .orElse(staged);
        }
        for (Prim node : fresh) {
            mergeNode(siblings, staged, node, filePath, status);
        }

        if (primPath == null) {
            Set<String> freshNames = new HashSet<>();
            fresh.forEach(p -> freshNames.add(p.getName()));
            int before = staged.size();
            staged.removeIf(p -> p.getProvenance()
                    .map(prov -> prov.sourceFile().equals(filePath) && !freshNames.contains(p.getName()))
                    .orElse(false));
            log.debug("stage.refresh.pruned filePath={} removed={}", filePath, before - staged.size());
        }

        stage.setStagedPrims(staged);
        log.info("stage.refresh.completed filePath={} primPath={} freshRoots={}", filePath, primPath, fresh.size());
        return compose(stage, context);
    }

    private void mergeNode(List<Prim> siblings, List<Prim> wholeTree, Prim incoming, String file, LayerStatus status) {
        Optional<Prim> existing = siblings.stream()
                .filter(p -> p.getName().equals(incoming.getName()))
                .findFirst();
        if (existing.isPresent()) {
            Prim node = existing.get();
            node.setType(incoming.getType());
            node.getProperties().putAll(incoming.getProperties());
            if (node.hasAssetReference()) {
                node.getChildren().clear();
            } else {
                for (Prim child : incoming.getChildren()) {
                    mergeNode(node.getChildren(), wholeTree, child, file, status);
                }
            }
            return;
        }
        if (PrimTree.containsPath(wholeTree, incoming.getPath())) {
            log.debug("stage.refresh.duplicate path={} skipped", incoming.getPath());
            return;
        }
        Prim added = incoming.deepCopy();
        added.setSpecifier(Specifier.DEFINE);
        stamp(added, file, status);
        siblings.add(added);
    }

    private static void stamp(Prim prim, String file, LayerStatus status) {
        prim.setProvenance(Provenance.of(file, prim.getPath(), status));
        for (Prim child : prim.getChildren()) {
            stamp(child, file, status);
        }
    }

    private static String warn(String warning) {
        log.warn("stage.warning reason=\"{}\"", warning);
        return warning;
    }
}
