package com.stage.composition.conflict;

import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.model.Layer;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import com.stage.composition.core.model.Property;
import com.stage.composition.core.model.Provenance;
import com.stage.composition.parse.PrimParser;
import com.stage.composition.resolve.Stage;
import com.stage.composition.security.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a prospective property change clashes with opinions held elsewhere.
 *
 * <p>Checks run in a fixed order and every match is reported:</p>
 * <ol>
 *   <li>ownership of the prim's provenance layer,</li>
 *   <li>a declaration in the prim's originating layer,</li>
 *   <li>a staged override in the change-log layer,</li>
 *   <li>declarations in more than one layer of the stack.</li>
 * </ol>
 * <p>Layers are parsed fresh on every call; a layer that fails to parse is ignored.</p>
 */
public class ConflictDetector {
    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    static final String SOURCE_LAYER = "layer";
    static final String SOURCE_STATEMENT = "statement";
    static final String SOURCE_MULTIPLE = "multiple_layers";

    private final PrimParser parser;
    private final String changelogLayer;

    public ConflictDetector(PrimParser parser, String changelogLayer) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.changelogLayer = Objects.requireNonNull(changelogLayer, "changelogLayer is required");
    }

    /**
     * Conflicts raised by setting {@code propertyName} of {@code prim} to {@code candidateValue}.
     *
     * @param prim           composed prim being edited
     * @param propertyName   property key as held by the prim (shared-namespace prefix removed)
     * @param candidateValue new value in its textual form, may be null
     * @return conflicts in check order, empty when the change is safe
     */
    public List<Conflict> detect(Prim prim, String propertyName, String candidateValue,
                                 Stage stage, StageContext context) {
        String current = prim.getPropertyText(propertyName).orElse(null);
        if (Objects.equals(current, candidateValue)) {
            log.debug("conflict.none path={} property={} reason=unchanged", prim.getPath(), propertyName);
            return List.of();
        }

        List<Conflict> conflicts = new ArrayList<>();
        Optional<Provenance> provenance = prim.getProvenance();
        Optional<Layer> sourceLayer = provenance.flatMap(p -> stage.getLayerStack().find(p.sourceFile()));

        sourceLayer.filter(layer -> isForeignOwner(layer.getOwner(), context))
                .ifPresent(layer -> conflicts.add(new Conflict(ConflictType.OWNERSHIP, SOURCE_LAYER,
                        layer.getFilePath(), layer.getOwner(), current, null)));

        provenance.ifPresent(p -> declaredValue(stage, p.sourceFile(), p.sourcePathOr(prim.getPath()), propertyName)
                .ifPresent(value -> conflicts.add(new Conflict(ConflictType.SOURCE_DEFINITION, SOURCE_LAYER,
                        p.sourceFile(), ownerOf(sourceLayer), value, null))));

        declaredValue(stage, changelogLayer, prim.getPath(), propertyName)
                .ifPresent(value -> conflicts.add(new Conflict(ConflictType.STAGED_OVERRIDE, SOURCE_STATEMENT,
                        changelogLayer, Conflict.STAGED_OWNER, value, null)));

        List<Conflict.LayerDefinition> definitions = new ArrayList<>();
        for (Layer layer : stage.getLayerStack().getLayers()) {
            declaredValue(stage, layer.getFilePath(), prim.getPath(), propertyName)
                    .ifPresent(value -> definitions.add(
                            new Conflict.LayerDefinition(layer.getFilePath(), ownerOf(Optional.of(layer)), value)));
        }
        if (definitions.size() > 1) {
            conflicts.add(new Conflict(ConflictType.MULTI_LAYER_DEFINITION, SOURCE_MULTIPLE,
                    null, null, null, definitions));
        }

        if (conflicts.isEmpty()) {
            log.debug("conflict.none path={} property={}", prim.getPath(), propertyName);
        } else {
            log.info("conflict.detected path={} property={} count={} first={}",
                    prim.getPath(), propertyName, conflicts.size(), conflicts.get(0).type().code());
        }
        return conflicts;
    }

    private boolean isForeignOwner(String owner, StageContext context) {
        return owner != null && !owner.isBlank() && !owner.equals(context.identity());
    }

    private static String ownerOf(Optional<Layer> layer) {
        return layer.map(Layer::getOwner)
                .filter(owner -> !owner.isBlank())
                .orElse(Conflict.UNKNOWN_OWNER);
    }

    /**
     * Value of the property as declared in a loaded layer for the given path. Prims are matched
     * by path only.
     */
    private Optional<String> declaredValue(Stage stage, String file, String path, String propertyName) {
        Optional<String> text = stage.getText(file);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        List<Prim> roots;
        try {
            roots = parser.parse(text.get()).roots();
        } catch (MalformedSourceException e) {
            log.debug("conflict.layer.skipped file={} reason=\"{}\"", file, e.getMessage());
            return Optional.empty();
        }
        return PrimTree.findByPath(roots, path).flatMap(p -> p.getProperty(propertyName)).map(Property::asText);
    }
}
