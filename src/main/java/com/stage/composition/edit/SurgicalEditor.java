package com.stage.composition.edit;

import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.PrimNameValidator;
import com.stage.composition.core.StaleSpanException;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import com.stage.composition.core.model.SourceText;
import com.stage.composition.core.model.TextSpan;
import com.stage.composition.parse.BraceScanner;
import com.stage.composition.parse.ParsedDocument;
import com.stage.composition.parse.PrimParser;
import com.stage.composition.parse.ValueParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-in, text-out mutations of layer documents.
 *
 * <p>Every operation re-parses the text it is given to locate prims by their spans, then
 * splices only the affected range, so formatting and comments elsewhere survive untouched.
 * Operations that cannot be applied return the input unchanged with a warning; only an
 * invalid rename target is an error.</p>
 */
public class SurgicalEditor {
    private static final Logger log = LoggerFactory.getLogger(SurgicalEditor.class);

    private static final Set<String> QUOTED_TYPES = Set.of("string", "token", "asset");
    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^([ \\t]*)");

    private final PrimParser parser;
    private final String namespace;
    private final String indentUnit;

    public SurgicalEditor() {
        this(new PrimParser(), PrimParser.DEFAULT_NAMESPACE, "    ");
    }

    public SurgicalEditor(PrimParser parser) {
        this(parser, PrimParser.DEFAULT_NAMESPACE, "    ");
    }

    public SurgicalEditor(PrimParser parser, String namespace, String indentUnit) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.namespace = Objects.requireNonNull(namespace, "namespace is required");
        this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit is required");
    }

    /**
     * Inserts a prim block under the given parent. Missing trailing segments of the parent
     * path are synthesized as {@code over} blocks around the inserted text.
     *
     * @param parentPath parent prim path; null, empty or {@code /} appends at the end of the document
     */
    public EditResult insert(String text, String parentPath, String primText) {
        Objects.requireNonNull(primText, "primText is required");
        String source = text != null ? text : "";
        if (parentPath == null || parentPath.isEmpty() || "/".equals(parentPath)) {
            log.debug("edit.insert.root length={}", primText.length());
            return EditResult.applied(source + "\n" + primText);
        }

        ParsedDocument document;
        try {
            document = parser.parse(source);
        } catch (MalformedSourceException e) {
            return warn(source, "Cannot insert under " + parentPath + ": " + e.getMessage());
        }

        String[] segments = segments(parentPath);
        Prim ancestor = null;
        List<Prim> siblings = document.roots();
        int matched = 0;
        for (String segment : segments) {
            Optional<Prim> match = siblings.stream().filter(p -> p.getName().equals(segment)).findFirst();
            if (match.isEmpty()) {
                break;
            }
            ancestor = match.get();
            siblings = ancestor.getChildren();
            matched++;
        }

        StringBuilder open = new StringBuilder();
        StringBuilder close = new StringBuilder();
        for (int i = matched; i < segments.length; i++) {
            open.append("over \"").append(segments[i]).append("\" {\n");
            close.insert(0, "\n}");
        }
        String block = open + primText + close;

        if (ancestor == null) {
            log.debug("edit.insert.appended parentPath={} wrappers={}", parentPath, segments.length);
            return EditResult.applied(source + "\n" + block);
        }
        Optional<TextSpan> span = ancestor.getSpan();
        if (span.isEmpty()) {
            return warn(source, "Cannot insert under " + ancestor.getPath() + ": prim has no span");
        }
        int closeBrace = checkedOffset(span.get(), document.source(), span.get().end());
        String result = source.substring(0, closeBrace) + "\n" + block + "\n" + source.substring(closeBrace);
        log.debug("edit.insert.completed parentPath={} ancestor={} wrappers={}",
                parentPath, ancestor.getPath(), segments.length - matched);
        return EditResult.applied(result);
    }

    /**
     * Deletes a prim block, keyword through closing brace.
     */
    public EditResult remove(String text, String path) {
        String source = text != null ? text : "";
        ParsedDocument document;
        try {
            document = parser.parse(source);
        } catch (MalformedSourceException e) {
            return warn(source, "Cannot remove " + path + ": " + e.getMessage());
        }
        Optional<Prim> prim = document.find(path);
        if (prim.isEmpty()) {
            return warn(source, "Prim not found for removal: " + path);
        }
        Optional<TextSpan> span = prim.get().getSpan();
        if (span.isEmpty()) {
            return warn(source, "Prim has no span, cannot remove: " + path);
        }
        try {
            String result = span.get().cut(document.source());
            log.debug("edit.remove.completed path={} removedChars={}", path, span.get().length());
            return EditResult.applied(result);
        } catch (StaleSpanException e) {
            throw new IllegalStateException("Span does not belong to the parsed text", e);
        }
    }

    public EditResult updateProperty(String text, String path, String propertyName, String value) {
        return updateProperty(text, path, propertyName, value, "string");
    }

    /**
     * Sets a property on a prim. An existing declaration in the prim's own body has its value
     * replaced in place; otherwise a new declaration is inserted before the closing brace.
     * Unqualified names are placed in the shared namespace.
     *
     * @param type declared type used when inserting a new declaration
     */
    public EditResult updateProperty(String text, String path, String propertyName, String value, String type) {
        String source = text != null ? text : "";
        PrimNameValidator.validatePropertyName(propertyName);
        String declaredType = type == null || type.isBlank() ? "string" : type.trim();
        String rawValue = value != null ? value : "";

        ParsedDocument document;
        try {
            document = parser.parse(source);
        } catch (MalformedSourceException e) {
            return warn(source, "Cannot update property on " + path + ": " + e.getMessage());
        }
        Optional<Prim> found = PrimTree.findByPathOrName(document.roots(), path);
        if (found.isEmpty() || found.get().getSpan().isEmpty()) {
            return warn(source, "Prim not found: " + path + " (available paths: " + document.paths() + ")");
        }
        Prim prim = found.get();
        TextSpan span = prim.getSpan().get();
        checkedOffset(span, document.source(), span.start());

        String fullName = propertyName.contains(":") ? propertyName : namespace + ":" + propertyName;
        Pattern declaration = Pattern.compile(
                "(?<![\\w:.])(?:(?:custom|uniform|varying)[ \\t]+)*([A-Za-z_][A-Za-z0-9_]*(?:\\[\\])?)[ \\t]+"
                        + Pattern.quote(fullName) + "[ \\t]*=[ \\t]*");

        for (int[] segment : ownBodySegments(prim, span)) {
            Matcher m = declaration.matcher(source);
            m.region(segment[0], segment[1]);
            m.useTransparentBounds(true);
            while (m.find()) {
                if (!isCode(source, segment[0], m.start())) {
                    continue;
                }
                int valueEnd = valueEnd(source, m.end(), segment[1]);
                String replacement = formatValue(m.group(1), rawValue);
                String result = source.substring(0, m.end()) + replacement + source.substring(valueEnd);
                log.debug("edit.property.updated path={} property={}", prim.getPath(), fullName);
                return EditResult.applied(result);
            }
        }

        String indent = detectIndent(source, prim, span);
        String line = indent + "custom " + declaredType + " " + fullName + " = " + formatValue(declaredType, rawValue);
        int closeBrace = span.end();
        int lineStart = source.lastIndexOf('\n', closeBrace - 1) + 1;
        String result;
        if (source.substring(lineStart, closeBrace).isBlank() && lineStart > span.openBrace()) {
            result = source.substring(0, lineStart) + line + "\n" + source.substring(lineStart);
        } else {
            int cut = closeBrace;
            while (cut > span.openBrace() + 1 && isBlank(source.charAt(cut - 1))) {
                cut--;
            }
            result = source.substring(0, cut) + "\n" + line + "\n" + source.substring(closeBrace);
        }
        log.debug("edit.property.inserted path={} property={}", prim.getPath(), fullName);
        return EditResult.applied(result);
    }

    /**
     * Renames a prim and rewrites every reference targeting exactly its old path.
     *
     * @throws com.stage.composition.core.ValidationException if the new name is not a valid identifier
     */
    public RenameResult rename(String text, String path, String newName) {
        PrimNameValidator.validatePrimName(newName);
        String source = text != null ? text : "";

        ParsedDocument document;
        try {
            document = parser.parse(source);
        } catch (MalformedSourceException e) {
            return warnRename(source, path, "Cannot rename " + path + ": " + e.getMessage());
        }
        Optional<Prim> found = document.find(path);
        if (found.isEmpty() || found.get().getSpan().isEmpty()) {
            return warnRename(source, path, "Prim not found: " + path);
        }
        Prim prim = found.get();
        TextSpan span = prim.getSpan().get();
        checkedOffset(span, document.source(), span.start());

        String header = source.substring(span.start(), span.openBrace());
        Pattern namePattern = Pattern.compile("^(\\w+(?:\\s+[A-Za-z_]\\w*)?\\s+)\"" + Pattern.quote(prim.getName()) + "\"");
        Matcher m = namePattern.matcher(header);
        if (!m.find()) {
            return warnRename(source, path, "Could not find prim definition for: " + prim.getName());
        }
        String newHeader = m.group(1) + "\"" + newName + "\"" + header.substring(m.end());
        String parent = prim.getParentPath();
        String newPath = (parent == null ? "" : parent) + "/" + newName;

        String result = source.substring(0, span.start()) + newHeader + source.substring(span.openBrace());
        Pattern referencePattern = Pattern.compile("(@?[^@\\s<>\"\\[\\]]+@)<" + Pattern.quote(path) + ">");
        Matcher refs = referencePattern.matcher(result);
        int rewritten = 0;
        StringBuilder sb = new StringBuilder();
        while (refs.find()) {
            refs.appendReplacement(sb, Matcher.quoteReplacement(refs.group(1) + "<" + newPath + ">"));
            rewritten++;
        }
        refs.appendTail(sb);

        log.debug("edit.rename.completed oldPath={} newPath={} referencesRewritten={}", path, newPath, rewritten);
        return RenameResult.renamed(sb.toString(), newPath);
    }

    /**
     * Formats a value for the given declared type: string-like types are quoted,
     * everything else is written verbatim.
     */
    static String formatValue(String type, String value) {
        if (type == null || QUOTED_TYPES.contains(type)) {
            return "\"" + ValueParser.escape(ValueParser.unquote(value)) + "\"";
        }
        return value.trim();
    }

    private List<int[]> ownBodySegments(Prim prim, TextSpan span) {
        List<int[]> segments = new ArrayList<>();
        int cursor = span.openBrace() + 1;
        for (Prim child : prim.getChildren()) {
            Optional<TextSpan> childSpan = child.getSpan();
            if (childSpan.isEmpty()) {
                continue;
            }
            segments.add(new int[]{cursor, childSpan.get().start()});
            cursor = childSpan.get().end() + 1;
        }
        segments.add(new int[]{cursor, span.end()});
        return segments;
    }

    /**
     * Indent of the first own-body line that starts on a line of its own and sits deeper than
     * the header, else the header's indent plus one level.
     */
    private String detectIndent(String source, Prim prim, TextSpan span) {
        String headerIndent = leadingWhitespace(source, source.lastIndexOf('\n', span.start() - 1) + 1);
        for (int[] segment : ownBodySegments(prim, span)) {
            int lineStart = source.indexOf('\n', segment[0]) + 1;
            while (lineStart > 0 && lineStart < segment[1]) {
                int lineEnd = source.indexOf('\n', lineStart);
                if (lineEnd < 0 || lineEnd > segment[1]) {
                    lineEnd = segment[1];
                }
                String indent = leadingWhitespace(source, lineStart);
                if (!source.substring(lineStart, lineEnd).isBlank() && indent.length() > headerIndent.length()) {
                    return indent;
                }
                lineStart = lineEnd + 1;
            }
        }
        return headerIndent + indentUnit;
    }

    private static String leadingWhitespace(String source, int lineStart) {
        int lineEnd = source.indexOf('\n', lineStart);
        Matcher m = LEADING_WHITESPACE.matcher(source.substring(lineStart, lineEnd < 0 ? source.length() : lineEnd));
        return m.find() ? m.group(1) : "";
    }

    /**
     * Whether {@code index} lies outside strings and comments, scanning from {@code from}.
     */
    private static boolean isCode(String source, int from, int index) {
        int i = from;
        while (i < index) {
            char c = source.charAt(i);
            if (c == '"' || c == '\'') {
                i = BraceScanner.skipString(source, i);
            } else if (c == '#') {
                i = BraceScanner.skipComment(source, i);
            }
            if (i >= index) {
                return false;
            }
            i++;
        }
        return true;
    }

    /**
     * End of a declared value: the line end, an unquoted {@code #} or the limit, trailing blanks excluded.
     */
    private static int valueEnd(String source, int from, int limit) {
        int i = from;
        while (i < limit) {
            char c = source.charAt(i);
            if (c == '\n' || c == '#') {
                break;
            }
            if (c == '"' || c == '\'') {
                i = Math.min(BraceScanner.skipString(source, i), limit - 1);
            }
            i++;
        }
        int end = Math.min(i, limit);
        while (end > from && isBlank(source.charAt(end - 1))) {
            end--;
        }
        return end;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\r';
    }

    private static int checkedOffset(TextSpan span, SourceText source, int offset) {
        try {
            span.checkAgainst(source);
        } catch (StaleSpanException e) {
            throw new IllegalStateException("Span does not belong to the parsed text", e);
        }
        return offset;
    }

    private static String[] segments(String path) {
        return Arrays.stream(path.split("/")).filter(s -> !s.isEmpty()).toArray(String[]::new);
    }

    private static EditResult warn(String text, String warning) {
        log.warn("edit.skipped reason=\"{}\"", warning);
        return EditResult.unchanged(text, warning);
    }

    private static RenameResult warnRename(String text, String path, String warning) {
        log.warn("edit.rename.skipped reason=\"{}\"", warning);
        return RenameResult.unchanged(text, path, warning);
    }
}
