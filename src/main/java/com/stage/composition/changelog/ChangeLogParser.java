package com.stage.composition.changelog;

import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.model.CommitEntry;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PropertyValue;
import com.stage.composition.parse.BraceScanner;
import com.stage.composition.parse.PrimParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads commit entries back out of change-log layer text.
 *
 * <p>Entries are the {@code def "Log_<id>"} blocks, found in document order. Each block is
 * parsed as a prim: its properties are the entry fields and its children are the prims
 * serialized with the entry. A block whose braces never close ends the scan; entries read
 * before it are kept.</p>
 */
public class ChangeLogParser {
    private static final Logger log = LoggerFactory.getLogger(ChangeLogParser.class);

    static final String ENTRY_PREFIX = "Log_";
    private static final Pattern ENTRY_HEADER = Pattern.compile("def\\s+\"" + ENTRY_PREFIX + "([^\"]+)\"\\s*\\{");
    private static final String NULL_TOKEN = "null";

    private final PrimParser parser;

    public ChangeLogParser() {
        this(new PrimParser());
    }

    public ChangeLogParser(PrimParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser is required");
    }

    public CommitHistory parse(String text) {
        if (text == null || text.isEmpty()) {
            return CommitHistory.empty();
        }
        List<CommitEntry> entries = new ArrayList<>();
        Matcher matcher = ENTRY_HEADER.matcher(text);
        int cursor = 0;
        while (cursor < text.length() && matcher.find(cursor)) {
            String id = matcher.group(1);
            int openBrace = matcher.end() - 1;
            int closeBrace = BraceScanner.findMatchingBrace(text, openBrace);
            if (closeBrace < 0) {
                log.error("changelog.malformed id={} offset={} reason=\"missing closing brace\"", id, openBrace);
                break;
            }
            Optional<CommitEntry> entry = readEntry(id, text.substring(matcher.start(), closeBrace + 1));
            if (entry.isEmpty()) {
                break;
            }
            entries.add(entry.get());
            cursor = closeBrace + 1;
        }
        CommitHistory history = CommitHistory.of(entries);
        log.debug("changelog.parsed entries={} roots={}", history.size(), history.roots().size());
        return history;
    }

    private Optional<CommitEntry> readEntry(String id, String block) {
        Prim prim;
        try {
            List<Prim> roots = parser.parse(block).roots();
            if (roots.isEmpty()) {
                log.error("changelog.malformed id={} reason=\"entry block has no prim\"", id);
                return Optional.empty();
            }
            prim = roots.get(0);
        } catch (MalformedSourceException e) {
            log.error("changelog.malformed id={} reason=\"{}\"", id, e.getMessage());
            return Optional.empty();
        }

        Instant timestamp = text(prim, "timestamp").flatMap(ChangeLogParser::toInstant).orElse(null);
        List<Prim> prims = new ArrayList<>();
        for (Prim child : prim.getChildren()) {
            prims.add(child.rebase("/" + child.getName()));
        }

        return Optional.of(CommitEntry.builder()
                .id(id)
                .sequence(sequenceOf(prim, timestamp))
                .timestamp(timestamp)
                .author(text(prim, "user").orElse(null))
                .type(text(prim, "type").orElse(CommitEntry.TYPE_COMMIT))
                .message(text(prim, "message").orElse(null))
                .status(text(prim, "status").orElse(null))
                .parentId(text(prim, "parent").orElse(null))
                .affectedPaths(stagedPaths(prim))
                .fileName(text(prim, "fileName").orElse(null))
                .referencePath(text(prim, "usdReferencePath").orElse(null))
                .contentHash(text(prim, "contentHash").orElse(null))
                .fileSize(number(prim, "fileSize").orElse(0L))
                .sourceStatus(text(prim, "sourceStatus").orElse(null))
                .targetStatus(text(prim, "targetStatus").orElse(null))
                .oldName(text(prim, "oldName").orElse(null))
                .newName(text(prim, "newName").orElse(null))
                .oldPath(text(prim, "oldPath").orElse(null))
                .newPath(text(prim, "newPath").orElse(null))
                .entityType(text(prim, "entityType").orElse(null))
                .prims(prims)
                .build());
    }

    private static long sequenceOf(Prim prim, Instant timestamp) {
        return number(prim, "entry").orElseGet(() -> timestamp != null ? timestamp.toEpochMilli() : 0L);
    }

    /**
     * Field text, with empty strings and the {@code null} token treated as absent.
     */
    private static Optional<String> text(Prim prim, String field) {
        return prim.getPropertyText(field)
                .filter(v -> !v.isEmpty() && !NULL_TOKEN.equals(v));
    }

    private static Optional<Long> number(Prim prim, String field) {
        return prim.getProperty(field).flatMap(p -> {
            if (p.value() instanceof PropertyValue.NumberValue n) {
                return Optional.of((long) n.value());
            }
            try {
                return Optional.of(Long.parseLong(p.asText().trim()));
            } catch (NumberFormatException e) {
                log.debug("changelog.field.ignored field={} value={}", field, p.asText());
                return Optional.empty();
            }
        });
    }

    private static List<String> stagedPaths(Prim prim) {
        return prim.getProperty("stagedPrims")
                .map(p -> p.value() instanceof PropertyValue.StringArrayValue a ? a.values() : List.<String>of())
                .orElse(List.of());
    }

    private static Optional<Instant> toInstant(String value) {
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException e) {
            log.debug("changelog.timestamp.ignored value={}", value);
            return Optional.empty();
        }
    }
}
