package com.stage.composition.edit;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a rename: the resulting text, the prim's path afterwards and an optional warning.
 * When the rename could not be applied the text is unchanged and the path is the original one.
 */
public record RenameResult(String text, String newPath, String warningMessage) {

    public RenameResult {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(newPath, "newPath is required");
    }

    public static RenameResult renamed(String text, String newPath) {
        return new RenameResult(text, newPath, null);
    }

    public static RenameResult unchanged(String text, String originalPath, String warning) {
        return new RenameResult(text, originalPath, warning);
    }

    public Optional<String> warning() {
        return Optional.ofNullable(warningMessage);
    }

    public boolean isRenamed() {
        return warningMessage == null;
    }
}
