package com.stage.composition.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stage.composition.core.model.AssetReference;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Property;
import com.stage.composition.core.model.PropertyValue;
import com.stage.composition.core.model.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Exports a composed prim tree as JSON for downstream viewers.
 *
 * <p>Output shape:</p>
 * <pre>
 * [
 *   {
 *     "path": "/World",
 *     "name": "World",
 *     "specifier": "def",
 *     "type": "Xform",
 *     "properties": { "status": "Published", "opacity": 0.5 },
 *     "reference": { "assetPath": "a.usda", "targetPath": "/World" },
 *     "provenance": { "sourceFile": "a.usda", "sourcePath": "/World", "sourceLayerStatus": "Published" },
 *     "children": [ ... ]
 *   }
 * ]
 * </pre>
 */
public class StageJsonExporter {
    private static final Logger log = LoggerFactory.getLogger(StageJsonExporter.class);

    private final ObjectMapper objectMapper;

    public StageJsonExporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public StageJsonExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ArrayNode toTree(List<Prim> roots) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Prim root : roots) {
            array.add(toNode(root));
        }
        return array;
    }

    /**
     * @throws IllegalStateException if the tree cannot be written
     */
    public String export(List<Prim> roots) {
        try {
            String json = objectMapper.writeValueAsString(toTree(roots));
            log.debug("export.completed roots={} length={}", roots.size(), json.length());
            return json;
        } catch (JsonProcessingException e) {
            log.warn("export.failed reason=\"{}\"", e.getMessage());
            throw new IllegalStateException("Failed to export stage as JSON", e);
        }
    }

    ObjectNode toNode(Prim prim) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("path", prim.getPath());
        node.put("name", prim.getName());
        node.put("specifier", prim.getSpecifier().keyword());
        if (prim.getType() != null) {
            node.put("type", prim.getType());
        }

        ObjectNode properties = node.putObject("properties");
        for (Map.Entry<String, Property> entry : prim.getProperties().entrySet()) {
            putValue(properties, entry.getKey(), entry.getValue().value());
        }

        if (prim.getReference() != null) {
            node.set("reference", arcNode(prim.getReference()));
        }
        if (prim.getPayload() != null) {
            node.set("payload", arcNode(prim.getPayload()));
        }
        prim.getProvenance().ifPresent(p -> node.set("provenance", provenanceNode(p)));

        ArrayNode children = node.putArray("children");
        for (Prim child : prim.getChildren()) {
            children.add(toNode(child));
        }
        return node;
    }

    private void putValue(ObjectNode target, String key, PropertyValue value) {
        if (value instanceof PropertyValue.NumberValue n) {
            target.put(key, n.value());
        } else if (value instanceof PropertyValue.BoolValue b) {
            target.put(key, b.value());
        } else if (value instanceof PropertyValue.ColorValue c) {
            target.putArray(key).add(c.r()).add(c.g()).add(c.b());
        } else if (value instanceof PropertyValue.StringArrayValue a) {
            ArrayNode items = target.putArray(key);
            a.values().forEach(items::add);
        } else {
            target.put(key, value.asText());
        }
    }

    private ObjectNode arcNode(AssetReference arc) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("assetPath", arc.assetPath());
        if (arc.hasTargetPath()) {
            node.put("targetPath", arc.targetPath());
        }
        return node;
    }

    private ObjectNode provenanceNode(Provenance provenance) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("sourceFile", provenance.sourceFile());
        if (provenance.sourcePath() != null) {
            node.put("sourcePath", provenance.sourcePath());
        }
        if (provenance.sourceLayerStatus() != null) {
            node.put("sourceLayerStatus", provenance.sourceLayerStatus().token());
        }
        return node;
    }
}
