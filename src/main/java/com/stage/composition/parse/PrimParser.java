package com.stage.composition.parse;

import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.model.AssetReference;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.Property;
import com.stage.composition.core.model.PropertyValue;
import com.stage.composition.core.model.ReferenceKind;
import com.stage.composition.core.model.SourceText;
import com.stage.composition.core.model.Specifier;
import com.stage.composition.core.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Position-tracking parser turning layer text into a prim tree.
 *
 * <p>Recognizes prim blocks of the form
 * {@code <def|over|class> [Type] "Name" [( metadata )] { body }}, the properties declared
 * in each body and a single reference and payload arc per prim. Every prim carries the
 * {@link TextSpan} of its block so the surgical editor can splice the original text.</p>
 *
 * <p>Properties in the shared namespace are keyed by their unqualified name
 * ({@code primvars:status} becomes {@code status}).</p>
 */
public class PrimParser {
    private static final Logger log = LoggerFactory.getLogger(PrimParser.class);

    public static final String DEFAULT_NAMESPACE = "primvars";

    private static final Pattern PROPERTY_LINE = Pattern.compile(
            "^\\s*((?:(?:custom|uniform|varying)\\s+)*)"
                    + "([A-Za-z_][A-Za-z0-9_]*(?:\\[\\])?)\\s+"
                    + "([A-Za-z_][A-Za-z0-9_:.]*)\\s*=\\s*(.*?)\\s*$");

    private static final Set<String> LIST_OPS = Set.of("prepend", "append", "add", "delete", "reorder");
    private static final Set<String> ARC_NAMES = Set.of("references", "payload", "inherits", "specializes");

    private final String namespacePrefix;

    public PrimParser() {
        this(DEFAULT_NAMESPACE);
    }

    /**
     * @param namespace shared property namespace whose prefix is stripped from property keys
     */
    public PrimParser(String namespace) {
        this.namespacePrefix = namespace + ":";
    }

    /**
     * Parses raw text as a new source generation.
     *
     * @throws MalformedSourceException if a prim's opening brace has no matching closing brace
     */
    public ParsedDocument parse(String text) {
        return parse(SourceText.of(text));
    }

    /**
     * Parses the given source generation.
     *
     * @throws MalformedSourceException if a prim's opening brace has no matching closing brace
     */
    public ParsedDocument parse(SourceText source) {
        List<Prim> roots = new ArrayList<>();
        parseRange(source, 0, source.length(), "", roots);
        log.debug("parse.completed generation={} roots={}", source.generation(), roots.size());
        return new ParsedDocument(source, roots);
    }

    /**
     * Property key for a declared name: the shared namespace prefix is dropped.
     */
    public String keyFor(String declaredName) {
        return declaredName.startsWith(namespacePrefix)
                ? declaredName.substring(namespacePrefix.length())
                : declaredName;
    }

    private void parseRange(SourceText source, int from, int to, String parentPath, List<Prim> out) {
        String text = source.text();
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = BraceScanner.skipString(text, i) + 1;
                continue;
            }
            if (c == '#') {
                i = BraceScanner.skipComment(text, i) + 1;
                continue;
            }
            if (BraceScanner.isIdentifierStart(c) && (i == 0 || !isWordChar(text.charAt(i - 1)))) {
                int wordEnd = i;
                while (wordEnd < to && BraceScanner.isIdentifierPart(text.charAt(wordEnd))) {
                    wordEnd++;
                }
                Optional<Specifier> specifier = Specifier.fromKeyword(text.substring(i, wordEnd));
                if (specifier.isPresent()) {
                    Optional<Header> header = readHeader(text, wordEnd, to);
                    if (header.isPresent()) {
                        Prim prim = parsePrim(source, i, specifier.get(), header.get(), parentPath);
                        out.add(prim);
                        i = prim.getSpan().map(TextSpan::end).orElse(wordEnd) + 1;
                        continue;
                    }
                }
                i = wordEnd;
                continue;
            }
            i++;
        }
    }

    private Prim parsePrim(SourceText source, int start, Specifier specifier, Header header, String parentPath) {
        String text = source.text();
        int close = BraceScanner.findMatchingBrace(text, header.openBrace());
        if (close < 0) {
            throw new MalformedSourceException(
                    "Unbalanced braces: prim \"" + header.name() + "\" is never closed", header.openBrace());
        }
        String path = parentPath + "/" + header.name();

        List<Prim> children = new ArrayList<>();
        parseRange(source, header.openBrace() + 1, close, path, children);

        String ownBody = ownBody(text, header.openBrace() + 1, close, children);
        Map<String, Property> properties = parseProperties(ownBody);

        AssetReference reference = ReferenceParser.find(header.metadata(), ReferenceKind.REFERENCE)
                .or(() -> ReferenceParser.find(ownBody, ReferenceKind.REFERENCE))
                .orElse(null);
        AssetReference payload = ReferenceParser.find(header.metadata(), ReferenceKind.PAYLOAD)
                .or(() -> ReferenceParser.find(ownBody, ReferenceKind.PAYLOAD))
                .orElse(null);

        log.trace("parse.prim path={} type={} properties={} children={}",
                path, header.type(), properties.size(), children.size());

        return Prim.builder()
                .path(path)
                .name(header.name())
                .specifier(specifier)
                .type(header.type())
                .properties(properties)
                .children(children)
                .reference(reference)
                .payload(payload)
                .span(new TextSpan(source.generation(), start, header.openBrace(), close))
                .build();
    }

    /**
     * Reads the optional type, the quoted name, the optional metadata block and the
     * opening brace that follow a specifier keyword.
     */
    private Optional<Header> readHeader(String text, int from, int limit) {
        int i = BraceScanner.skipWhitespace(text, from);
        String type = null;
        if (i < limit && BraceScanner.isIdentifierStart(text.charAt(i))) {
            int typeEnd = i;
            while (typeEnd < limit && BraceScanner.isIdentifierPart(text.charAt(typeEnd))) {
                typeEnd++;
            }
            type = text.substring(i, typeEnd);
            i = BraceScanner.skipWhitespace(text, typeEnd);
        }
        if (i >= limit || text.charAt(i) != '"') {
            return Optional.empty();
        }
        int nameEnd = text.indexOf('"', i + 1);
        if (nameEnd < 0 || nameEnd >= limit) {
            return Optional.empty();
        }
        String name = text.substring(i + 1, nameEnd);
        if (name.isEmpty() || name.indexOf('\n') >= 0) {
            return Optional.empty();
        }
        i = BraceScanner.skipWhitespace(text, nameEnd + 1);

        String metadata = "";
        if (i < limit && text.charAt(i) == '(') {
            int closeParen = BraceScanner.findMatching(text, i, '(', ')');
            if (closeParen < 0 || closeParen >= limit) {
                return Optional.empty();
            }
            metadata = text.substring(i + 1, closeParen);
            i = BraceScanner.skipWhitespace(text, closeParen + 1);
        }
        if (i >= limit || text.charAt(i) != '{') {
            return Optional.empty();
        }
        return Optional.of(new Header(type, name, metadata, i));
    }

    private static String ownBody(String text, int from, int to, List<Prim> children) {
        StringBuilder sb = new StringBuilder(to - from);
        int cursor = from;
        for (Prim child : children) {
            TextSpan span = child.getSpan().orElseThrow();
            sb.append(text, cursor, span.start()).append('\n');
            cursor = span.end() + 1;
        }
        sb.append(text, cursor, to);
        return sb.toString();
    }

    private Map<String, Property> parseProperties(String body) {
        Map<String, Property> properties = new LinkedHashMap<>();
        for (String line : body.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher m = PROPERTY_LINE.matcher(trimmed);
            if (!m.matches()) {
                continue;
            }
            String qualifiers = m.group(1);
            String typeName = m.group(2);
            String name = m.group(3);
            String raw = stripTrailingComment(m.group(4));
            if (LIST_OPS.contains(typeName) || ARC_NAMES.contains(name) || raw.isEmpty()) {
                continue;
            }
            boolean custom = qualifiers.contains("custom");
            PropertyValue value = ValueParser.parse(typeName, raw);
            properties.put(keyFor(name), new Property(name, typeName, custom, raw, value));
        }
        return properties;
    }

    private static String stripTrailingComment(String raw) {
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '"' || c == '\'') {
                i = BraceScanner.skipString(raw, i) + 1;
                continue;
            }
            if (c == '#') {
                return raw.substring(0, i).strip();
            }
            i++;
        }
        return raw.strip();
    }

    private static boolean isWordChar(char c) {
        return BraceScanner.isIdentifierPart(c) || c == ':' || c == '.';
    }

    private record Header(String type, String name, String metadata, int openBrace) {
    }
}
