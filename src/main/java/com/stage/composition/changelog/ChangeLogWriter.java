package com.stage.composition.changelog;

import com.stage.composition.compose.PrimComposer;
import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.model.CommitEntry;
import com.stage.composition.edit.EditResult;
import com.stage.composition.edit.SurgicalEditor;
import com.stage.composition.parse.PrimParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Appends commit entries to the change-log layer text, under its {@code ChangeLog} root.
 */
public class ChangeLogWriter {
    private static final Logger log = LoggerFactory.getLogger(ChangeLogWriter.class);

    public static final String DEFAULT_ROOT = "ChangeLog";

    private final PrimComposer composer;
    private final SurgicalEditor editor;
    private final PrimParser parser;
    private final String rootName;

    public ChangeLogWriter() {
        this(new PrimComposer(), new SurgicalEditor(), new PrimParser(), DEFAULT_ROOT);
    }

    public ChangeLogWriter(PrimComposer composer, SurgicalEditor editor, PrimParser parser, String rootName) {
        this.composer = Objects.requireNonNull(composer, "composer is required");
        this.editor = Objects.requireNonNull(editor, "editor is required");
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.rootName = Objects.requireNonNull(rootName, "rootName is required");
    }

    /**
     * Adds the entry as the last child of the change-log root, creating the root first
     * when the text has none.
     */
    public EditResult append(String changelogText, CommitEntry entry) {
        String text = withRoot(changelogText != null ? changelogText : "");
        String block = composer.composeLogEntry(entry, 1);
        EditResult result = editor.insert(text, "/" + rootName, block);
        if (result.isApplied()) {
            log.info("changelog.appended id={} type={} author={} sequence={}",
                    entry.id(), entry.type(), entry.author(), entry.sequence());
        }
        return result;
    }

    /**
     * The text with an empty {@code over} root for the change log appended if it has none.
     */
    String withRoot(String text) {
        try {
            if (parser.parse(text).find("/" + rootName).isPresent()) {
                return text;
            }
        } catch (MalformedSourceException e) {
            log.warn("changelog.scaffold.skipped reason=\"{}\"", e.getMessage());
            return text;
        }
        StringBuilder sb = new StringBuilder(text.isBlank() ? "#usda 1.0\n" : text);
        if (sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
        sb.append('\n').append("over \"").append(rootName).append("\"\n{\n}\n");
        log.debug("changelog.scaffold.created root={}", rootName);
        return sb.toString();
    }
}
