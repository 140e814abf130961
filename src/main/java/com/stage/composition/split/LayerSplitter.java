package com.stage.composition.split;

import com.stage.composition.compose.PrimComposer;
import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.StaleSpanException;
import com.stage.composition.core.model.Prim;
import com.stage.composition.parse.ParsedDocument;
import com.stage.composition.parse.PrimParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one multi-prim document into one atomic layer document per prim.
 *
 * <p>A document with a single root that has children is treated as a container and its
 * children are split out instead. Each atomic file is named {@code <base>_<prim>.usda}.
 * A {@code Mesh} prim is renamed {@code Mesh_<prim>} and wrapped in an {@code Xform} carrying
 * the original name.</p>
 */
public class LayerSplitter {
    private static final Logger log = LoggerFactory.getLogger(LayerSplitter.class);

    static final String MESH_TYPE = "Mesh";
    static final String MESH_PREFIX = "Mesh_";
    private static final Pattern HEADER = Pattern.compile("(def|define|over|override|class)\\s+(\\w+)\\s+\"([^\"]+)\"");
    private static final Pattern EXTENSION = Pattern.compile("\\.(usda|usd)$", Pattern.CASE_INSENSITIVE);

    private final PrimParser parser;
    private final PrimComposer composer;
    private final String indentUnit;

    public LayerSplitter() {
        this(new PrimParser(), new PrimComposer(), PrimComposer.DEFAULT_INDENT);
    }

    public LayerSplitter(PrimParser parser, PrimComposer composer, String indentUnit) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.composer = Objects.requireNonNull(composer, "composer is required");
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit is required");
    }

    /**
     * @return atomic documents by file name, in prim order; the original document under its own
     * name when it has no prims or cannot be parsed
     */
    public Map<String, String> split(String text, String fileName) {
        Map<String, String> files = new LinkedHashMap<>();
        ParsedDocument document;
        try {
            document = parser.parse(text);
        } catch (MalformedSourceException e) {
            log.warn("split.skipped fileName={} reason=\"{}\"", fileName, e.getMessage());
            files.put(fileName, text);
            return files;
        }
        if (document.isEmpty()) {
            log.warn("split.skipped fileName={} reason=\"no prims\"", fileName);
            files.put(fileName, text);
            return files;
        }

        List<Prim> prims = document.roots();
        if (prims.size() == 1 && !prims.get(0).getChildren().isEmpty()) {
            log.debug("split.unwrapped fileName={} container={}", fileName, prims.get(0).getName());
            prims = prims.get(0).getChildren();
        }

        String base = EXTENSION.matcher(fileName).replaceFirst("");
        for (Prim prim : prims) {
            String raw;
            try {
                raw = prim.getSpan().orElseThrow().slice(document.source());
            } catch (StaleSpanException e) {
                throw new IllegalStateException("Span of " + prim.getPath() + " does not match its own parse", e);
            }
            String body = MESH_TYPE.equals(prim.getType()) ? wrapMesh(prim.getName(), raw) : raw + "\n";
            files.put(base + "_" + prim.getName() + ".usda", composer.layerHeader(prim.getName()) + body);
        }
        log.info("split.completed fileName={} files={}", fileName, files.size());
        return files;
    }

    private String wrapMesh(String name, String raw) {
        Matcher m = HEADER.matcher(raw);
        String renamed = raw;
        if (m.find()) {
            renamed = raw.substring(0, m.start())
                    + m.group(1) + " " + m.group(2) + " \"" + MESH_PREFIX + name + "\""
                    + raw.substring(m.end());
        }
        StringBuilder sb = new StringBuilder();
        sb.append("def Xform \"").append(name).append("\"\n{\n");
        for (String line : renamed.split("\n", -1)) {
            sb.append(line.isBlank() ? "" : indentUnit + line.stripTrailing()).append('\n');
        }
        sb.append("}\n");
        return sb.toString();
    }
}
