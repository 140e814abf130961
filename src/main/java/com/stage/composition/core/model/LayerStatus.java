package com.stage.composition.core.model;

import com.stage.composition.core.ValidationException;

/**
 * Publication status of a layer.
 * Statuses are strictly ordered: DRAFT &lt; SHARED &lt; PUBLISHED &lt; ARCHIVED,
 * and a layer only ever moves one step at a time.
 */
public enum LayerStatus {

    /** Work in progress, visible to its owner. Written as {@code WIP}. */
    DRAFT("WIP"),

    /** Shared with collaborators for review. */
    SHARED("Shared"),

    /** Released; the default status of prims without one. */
    PUBLISHED("Published"),

    /** Retired from active use. */
    ARCHIVED("Archived");

    private final String token;

    LayerStatus(String token) {
        this.token = token;
    }

    /**
     * Token used for this status inside documents.
     */
    public String token() {
        return token;
    }

    /**
     * Next status in the workflow; ARCHIVED stays ARCHIVED.
     */
    public LayerStatus next() {
        return this == ARCHIVED ? ARCHIVED : values()[ordinal() + 1];
    }

    /**
     * Previous status in the workflow; DRAFT stays DRAFT.
     */
    public LayerStatus previous() {
        return this == DRAFT ? DRAFT : values()[ordinal() - 1];
    }

    /**
     * Parses a status token, case-insensitive. {@code Draft} is accepted as an alias of {@code WIP}.
     *
     * @throws ValidationException if the token names no status
     */
    public static LayerStatus fromToken(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Layer status must not be null or blank", "status", value);
        }
        String trimmed = value.trim();
        if ("draft".equalsIgnoreCase(trimmed)) {
            return DRAFT;
        }
        for (LayerStatus status : values()) {
            if (status.token.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return status;
            }
        }
        throw new ValidationException(
                "Invalid status. Must be one of: WIP, Shared, Published, Archived", "status", value);
    }
}
