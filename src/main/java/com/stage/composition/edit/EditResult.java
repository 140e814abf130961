package com.stage.composition.edit;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a surgical edit: the resulting text and, when the edit could not be applied,
 * a warning explaining why. A warned result always carries the unchanged input.
 */
public record EditResult(String text, String warningMessage) {

    public EditResult {
        Objects.requireNonNull(text, "text is required");
    }

    public static EditResult applied(String text) {
        return new EditResult(text, null);
    }

    public static EditResult unchanged(String text, String warning) {
        return new EditResult(text, warning);
    }

    public Optional<String> warning() {
        return Optional.ofNullable(warningMessage);
    }

    public boolean isApplied() {
        return warningMessage == null;
    }
}
