package com.stage.composition.compose;

import com.stage.composition.core.model.AssetReference;
import com.stage.composition.core.model.CommitEntry;
import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Property;
import com.stage.composition.core.model.PropertyValue;
import com.stage.composition.core.model.Provenance;
import com.stage.composition.parse.ValueParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Serializes prim trees into canonical layer text.
 *
 * <p>Every composed prim carries a status line. The well-known properties
 * ({@code displayColor}, {@code displayName}, {@code status}, {@code opacity},
 * {@code entityType}) are written with fixed declarations; every other property is
 * written as a {@code custom} declaration typed after its value.</p>
 */
public class PrimComposer {
    private static final Logger log = LoggerFactory.getLogger(PrimComposer.class);

    public static final String DEFAULT_INDENT = "    ";

    static final String DISPLAY_COLOR = "displayColor";
    static final String DISPLAY_NAME = "displayName";
    static final String STATUS = "status";
    static final String OPACITY = "opacity";
    static final String ENTITY_TYPE = "entityType";

    private static final Set<String> WELL_KNOWN = Set.of(DISPLAY_COLOR, DISPLAY_NAME, STATUS, OPACITY, ENTITY_TYPE);

    private final String indentUnit;
    private final LayerStatus defaultStatus;

    public PrimComposer() {
        this(DEFAULT_INDENT, LayerStatus.PUBLISHED);
    }

    public PrimComposer(String indentUnit, LayerStatus defaultStatus) {
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit is required");
        this.defaultStatus = Objects.requireNonNull(defaultStatus, "defaultStatus is required");
    }

    /**
     * Composes prims at the given depth.
     *
     * @param fallbackStatus status written for prims with neither an own status nor provenance, may be null
     */
    public String compose(List<Prim> prims, int indent, LayerStatus fallbackStatus) {
        if (prims == null || prims.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (Prim prim : prims) {
            appendPrim(sb, prim, indent, fallbackStatus);
        }
        return sb.toString();
    }

    public String compose(Prim prim, int indent, LayerStatus fallbackStatus) {
        return compose(List.of(prim), indent, fallbackStatus);
    }

    /**
     * Composes a complete layer document: header plus root definitions.
     */
    public String composeLayer(List<Prim> roots, LayerStatus fallbackStatus) {
        String defaultPrim = roots == null || roots.isEmpty() ? "World" : roots.get(0).getName();
        String text = layerHeader(defaultPrim) + compose(roots, 0, fallbackStatus);
        log.debug("compose.layer roots={} defaultPrim={}", roots == null ? 0 : roots.size(), defaultPrim);
        return text;
    }

    /**
     * Layer document header naming the default prim, followed by a blank line.
     */
    public String layerHeader(String defaultPrim) {
        return "#usda 1.0\n(\n"
                + indentUnit + "defaultPrim = \"" + defaultPrim + "\"\n"
                + indentUnit + "upAxis = \"Z\"\n"
                + ")\n\n";
    }

    /**
     * Composes the stage document: the composed tree wrapped in an {@code assembly} Xform
     * named after the scene.
     */
    public String composeStage(String sceneName, List<Prim> composedRoots) {
        String wrapper = sceneName == null ? "Stage" : sceneName.replaceAll("\\s", "");
        if (wrapper.isEmpty()) {
            wrapper = "Stage";
        }
        return "#usda 1.0\n(\n"
                + indentUnit + "defaultPrim = \"" + wrapper + "\"\n"
                + indentUnit + "metersPerUnit = 1.0\n"
                + indentUnit + "upAxis = \"Z\"\n"
                + ")\n\n"
                + "def Xform \"" + wrapper + "\" (\n"
                + indentUnit + "kind = \"assembly\"\n"
                + ")\n{\n"
                + compose(composedRoots, 1, null)
                + "}\n";
    }

    /**
     * Composes a change-log entry block at the given depth, with the entry's prims nested inside.
     */
    public String composeLogEntry(CommitEntry entry, int indent) {
        String pad = indentUnit.repeat(indent);
        String inner = pad + indentUnit;
        StringBuilder sb = new StringBuilder();
        sb.append(pad).append("def \"Log_").append(entry.id()).append("\"\n");
        sb.append(pad).append("{\n");
        sb.append(inner).append("custom int entry = ").append(entry.sequence()).append('\n');
        appendString(sb, inner, "timestamp", entry.timestamp() == null
                ? "" : DateTimeFormatter.ISO_INSTANT.format(entry.timestamp()));
        appendString(sb, inner, "id", entry.id());
        appendString(sb, inner, "usdReferencePath", entry.referencePath());
        appendString(sb, inner, "fileName", entry.fileName());
        appendString(sb, inner, "contentHash", entry.contentHash());
        sb.append(inner).append("custom int fileSize = ").append(entry.fileSize()).append('\n');
        appendString(sb, inner, "type", entry.type());
        appendString(sb, inner, "user", entry.author());
        appendString(sb, inner, "status", entry.status());
        if (entry.message() != null) {
            appendString(sb, inner, "message", entry.message());
        }
        appendString(sb, inner, "oldName", entry.oldName());
        appendString(sb, inner, "newName", entry.newName());
        if (entry.oldPath() != null) {
            appendString(sb, inner, "oldPath", entry.oldPath());
        }
        if (entry.newPath() != null) {
            appendString(sb, inner, "newPath", entry.newPath());
        }
        appendString(sb, inner, "sourceStatus", entry.sourceStatus() != null ? entry.sourceStatus() : "null");
        appendString(sb, inner, "targetStatus", entry.targetStatus() != null ? entry.targetStatus() : "null");
        if (entry.parentId() != null) {
            appendString(sb, inner, "parent", entry.parentId());
        }
        if (!entry.affectedPaths().isEmpty()) {
            sb.append(inner).append("custom string[] stagedPrims = ")
                    .append(new PropertyValue.StringArrayValue(entry.affectedPaths()).asText())
                    .append('\n');
        }
        if (entry.entityType() != null) {
            appendString(sb, inner, "entityType", entry.entityType());
        }
        if (!entry.prims().isEmpty()) {
            sb.append('\n').append(compose(entry.prims(), indent + 1, null));
        }
        sb.append(pad).append("}\n");
        return sb.toString();
    }

    /**
     * Status written for a prim: its own status, else its provenance layer status,
     * else the fallback, else the configured default.
     */
    public String statusOf(Prim prim, LayerStatus fallbackStatus) {
        return prim.getPropertyText(STATUS)
                .filter(s -> !s.isBlank())
                .orElseGet(() -> prim.getProvenance()
                        .map(Provenance::sourceLayerStatus)
                        .filter(Objects::nonNull)
                        .or(() -> Optional.ofNullable(fallbackStatus))
                        .orElse(defaultStatus)
                        .token());
    }

    /**
     * Type written for a prim. An {@code Xform} directly containing a {@code Mesh} that
     * carries a reference or payload is written as {@code Scope}.
     */
    static String effectiveType(Prim prim) {
        String type = prim.getType();
        if ("Xform".equals(type) && prim.getChildren().stream()
                .anyMatch(c -> "Mesh".equals(c.getType()) && c.hasAssetReference())) {
            return "Scope";
        }
        return type;
    }

    /**
     * Canonical declaration line (without indentation) for a property.
     */
    public static String declaration(String key, Property property) {
        PropertyValue value = property.value();
        switch (key) {
            case DISPLAY_COLOR:
                if (value instanceof PropertyValue.ColorValue color) {
                    return "color3f[] primvars:displayColor = [" + color.asText() + "]";
                }
                break;
            case DISPLAY_NAME:
                return "custom string primvars:displayName = \"" + ValueParser.escape(value.asText()) + "\"";
            case STATUS:
                return "custom token primvars:status = \"" + ValueParser.escape(value.asText()) + "\"";
            case OPACITY:
                return "float opacity = " + value.asText();
            case ENTITY_TYPE:
                return "custom string primvars:entityType = \"" + ValueParser.escape(value.asText()) + "\"";
            default:
                break;
        }
        String name = property.name();
        if (value instanceof PropertyValue.ColorValue color) {
            return "color3f[] " + name + " = [" + color.asText() + "]";
        }
        if (value instanceof PropertyValue.NumberValue) {
            return "custom float " + name + " = " + value.asText();
        }
        if (value instanceof PropertyValue.BoolValue) {
            return "custom bool " + name + " = " + value.asText();
        }
        if (value instanceof PropertyValue.StringArrayValue) {
            return "custom string[] " + name + " = " + value.asText();
        }
        return "custom string " + name + " = \"" + ValueParser.escape(value.asText()) + "\"";
    }

    private void appendPrim(StringBuilder sb, Prim prim, int indent, LayerStatus fallbackStatus) {
        String pad = indentUnit.repeat(indent);
        String inner = pad + indentUnit;

        sb.append(pad).append(prim.getSpecifier().keyword()).append(' ');
        String type = effectiveType(prim);
        if (type != null && !type.isEmpty()) {
            sb.append(type).append(' ');
        }
        sb.append('"').append(prim.getName()).append('"');
        appendMetadata(sb, prim, pad);
        sb.append('\n').append(pad).append("{\n");

        appendKnown(sb, inner, prim, DISPLAY_COLOR);
        appendKnown(sb, inner, prim, DISPLAY_NAME);
        sb.append(inner).append(declaration(STATUS, Property.of(STATUS, statusOf(prim, fallbackStatus)))).append('\n');
        appendKnown(sb, inner, prim, OPACITY);
        appendKnown(sb, inner, prim, ENTITY_TYPE);
        prim.getProperties().forEach((key, property) -> {
            if (!WELL_KNOWN.contains(key)) {
                sb.append(inner).append(declaration(key, property)).append('\n');
            }
        });

        for (Prim child : prim.getChildren()) {
            appendPrim(sb, child, indent + 1, fallbackStatus);
        }
        sb.append(pad).append("}\n");
    }

    private static void appendKnown(StringBuilder sb, String inner, Prim prim, String key) {
        Property property = prim.getProperties().get(key);
        if (property != null) {
            sb.append(inner).append(declaration(key, property)).append('\n');
        }
    }

    private void appendMetadata(StringBuilder sb, Prim prim, String pad) {
        AssetReference reference = prim.getReference();
        AssetReference payload = prim.getPayload();
        if (reference == null && payload == null) {
            return;
        }
        sb.append(" (\n");
        if (reference != null) {
            sb.append(pad).append(indentUnit).append("prepend references = ").append(reference.format()).append('\n');
        }
        if (payload != null) {
            sb.append(pad).append(indentUnit).append("prepend payload = ").append(payload.format()).append('\n');
        }
        sb.append(pad).append(')');
    }

    private static void appendString(StringBuilder sb, String inner, String name, String value) {
        sb.append(inner).append("custom string ").append(name).append(" = \"")
                .append(value == null ? "" : ValueParser.escape(value)).append("\"\n");
    }
}
