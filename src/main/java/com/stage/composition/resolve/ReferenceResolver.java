package com.stage.composition.resolve;

import com.stage.composition.cache.LayerParseCache;
import com.stage.composition.cache.NoOpLayerParseCache;
import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.model.AssetReference;
import com.stage.composition.core.model.Layer;
import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import com.stage.composition.core.model.Property;
import com.stage.composition.core.model.Provenance;
import com.stage.composition.layer.LayerStack;
import com.stage.composition.parse.PrimParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves reference and payload arcs of staged prims against the loaded layers.
 *
 * <p>A prim carrying an arc takes the target prim's type, the target's properties with its
 * own properties on top, and a copy of the target's children placed under its own path.
 * The prim and every spliced descendant are stamped with the provenance of the target
 * layer. Targets that cannot be resolved leave the prim as it is and add a warning;
 * resolution of the remaining prims continues.</p>
 */
public class ReferenceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final PrimParser parser;
    private final LayerParseCache cache;
    private final LayerStatus defaultStatus;

    public ReferenceResolver() {
        this(new PrimParser(), new NoOpLayerParseCache(), LayerStatus.PUBLISHED);
    }

    public ReferenceResolver(PrimParser parser, LayerParseCache cache, LayerStatus defaultStatus) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.defaultStatus = Objects.requireNonNull(defaultStatus, "defaultStatus is required");
    }

    /**
     * Resolves every staged prim. Inputs are never mutated.
     *
     * @param staged staged (pre-reference) roots
     * @param stack  layer stack, used to look up target layer status
     * @param texts  loaded layer texts by file path
     */
    public ResolutionResult resolve(List<Prim> staged, LayerStack stack, Map<String, String> texts) {
        List<String> warnings = new ArrayList<>();
        Map<String, Optional<List<Prim>>> parsed = new LinkedHashMap<>();
        List<Prim> roots = new ArrayList<>();
        for (Prim prim : staged) {
            roots.add(resolvePrim(prim, stack, texts, parsed, warnings));
        }
        log.debug("resolve.completed roots={} layersParsed={} warnings={}",
                roots.size(), parsed.size(), warnings.size());
        return new ResolutionResult(roots, warnings);
    }

    /**
     * Status of a layer in the stack, or the default status when the layer is not in the stack.
     */
    public LayerStatus statusOf(LayerStack stack, String filePath) {
        return stack.find(filePath).map(Layer::getStatus).orElse(defaultStatus);
    }

    private Prim resolvePrim(Prim prim, LayerStack stack, Map<String, String> texts,
                             Map<String, Optional<List<Prim>>> parsed, List<String> warnings) {
        Prim resolved = prim.shallowCopy();

        Optional<AssetReference> arc = prim.getAssetReference();
        if (arc.isPresent()) {
            resolveArc(resolved, arc.get(), stack, texts, parsed, warnings);
        }

        for (Prim child : prim.getChildren()) {
            Prim resolvedChild = resolvePrim(child, stack, texts, parsed, warnings);
            Optional<Prim> spliced = resolved.getChildren().stream()
                    .filter(c -> c.getName().equals(resolvedChild.getName()))
                    .findFirst();
            if (spliced.isPresent()) {
                layerOnto(spliced.get(), resolvedChild);
            } else {
                resolved.addChild(resolvedChild);
            }
        }

        resolved.getProvenance().ifPresent(p -> inheritProvenance(resolved.getChildren(), p));
        return resolved;
    }

    private void resolveArc(Prim resolved, AssetReference arc, LayerStack stack, Map<String, String> texts,
                            Map<String, Optional<List<Prim>>> parsed, List<String> warnings) {
        String file = arc.assetPath();
        String text = texts.get(file);
        if (text == null) {
            warn(warnings, "Reference '" + file + "' from " + resolved.getPath() + " is not loaded");
            return;
        }
        Optional<List<Prim>> targetRoots = parsed.computeIfAbsent(file, f -> parseTarget(f, text, warnings));
        if (targetRoots.isEmpty()) {
            return;
        }
        List<Prim> roots = targetRoots.get();
        Optional<Prim> target = arc.hasTargetPath()
                ? PrimTree.findByPath(roots, arc.targetPath())
                : roots.stream().findFirst();
        if (target.isEmpty()) {
            warn(warnings, "Target prim '" + arc.target().orElse("<default>") + "' not found in '" + file + "'");
            return;
        }

        Prim source = target.get();
        LayerStatus status = statusOf(stack, file);

        resolved.setType(source.getType());
        Map<String, Property> properties = new LinkedHashMap<>(source.getProperties());
        properties.putAll(resolved.getProperties());
        resolved.getProperties().clear();
        resolved.getProperties().putAll(properties);

        for (Prim child : source.getChildren()) {
            resolved.addChild(splice(child, resolved.getPath() + "/" + child.getName(), file, status));
        }
        resolved.setProvenance(Provenance.of(file, source.getPath(), status));
        log.debug("resolve.arc path={} file={} target={} status={}",
                resolved.getPath(), file, source.getPath(), status.token());
    }

    private Optional<List<Prim>> parseTarget(String file, String text, List<String> warnings) {
        try {
            return Optional.of(cache.getOrParse(text, t -> parser.parse(t).roots()));
        } catch (MalformedSourceException e) {
            warn(warnings, "Reference target '" + file + "' is malformed: " + e.getMessage());
            return Optional.empty();
        }
    }

    private static Prim splice(Prim source, String newPath, String file, LayerStatus status) {
        Prim copy = Prim.builder(source)
                .path(newPath)
                .name(source.getName())
                .children(List.of())
                .provenance(Provenance.of(file, source.getPath(), status))
                .build();
        for (Prim child : source.getChildren()) {
            copy.addChild(splice(child, newPath + "/" + child.getName(), file, status));
        }
        return copy;
    }

    /**
     * Layers a local prim on top of a spliced prim with the same path.
     */
    private static void layerOnto(Prim spliced, Prim local) {
        spliced.getProperties().putAll(local.getProperties());
        if (local.getType() != null) {
            spliced.setType(local.getType());
        }
        for (Prim child : local.getChildren()) {
            Optional<Prim> match = spliced.getChildren().stream()
                    .filter(c -> c.getName().equals(child.getName()))
                    .findFirst();
            if (match.isPresent()) {
                layerOnto(match.get(), child);
            } else {
                spliced.addChild(child);
            }
        }
    }

    private static void inheritProvenance(List<Prim> children, Provenance parent) {
        for (Prim child : children) {
            if (child.getProvenance().isEmpty()) {
                child.setProvenance(Provenance.of(parent.sourceFile(), null, parent.sourceLayerStatus()));
            }
            inheritProvenance(child.getChildren(), child.getProvenance().orElse(parent));
        }
    }

    private static void warn(List<String> warnings, String warning) {
        log.warn("resolve.unresolved reason=\"{}\"", warning);
        warnings.add(warning);
    }
}
