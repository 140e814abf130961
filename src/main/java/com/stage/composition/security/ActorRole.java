package com.stage.composition.security;

import com.stage.composition.core.ValidationException;

import java.util.Locale;

/**
 * Roles an actor can act under.
 * Only {@link #PROJECT_MANAGER} is privileged: it sees every layer and may edit anything.
 */
public enum ActorRole {

    /** Privileged: sees and edits every layer regardless of ownership. */
    PROJECT_MANAGER("Project Manager"),

    /** May edit anything but, unlike the project manager, only sees unowned and own layers. */
    FIELD_ENGINEER("Field Engineer"),

    /** Read-only access. */
    FIELD_PERSON("Field Person"),

    /** Edits only content from layers it owns. */
    ARCHITECT("Architect"),

    /** Edits only content from layers it owns. */
    STRUCTURAL_ENGINEER("Structural Engineer");

    private final String displayName;

    ActorRole(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns true if this role bypasses visibility filtering and ownership checks.
     */
    public boolean isPrivileged() {
        return this == PROJECT_MANAGER;
    }

    /**
     * Returns true if this role may edit any prim regardless of layer ownership.
     */
    public boolean hasFullEditAccess() {
        return this == PROJECT_MANAGER || this == FIELD_ENGINEER;
    }

    public boolean isReadOnly() {
        return this == FIELD_PERSON;
    }

    /**
     * Parses a role from its display name ({@code Project Manager}) or constant name
     * ({@code PROJECT_MANAGER}), case-insensitive.
     *
     * @throws ValidationException if the value doesn't match any role
     */
    public static ActorRole fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Actor role must not be null or blank", "role", value);
        }
        String trimmed = value.trim();
        for (ActorRole role : values()) {
            if (role.displayName.equalsIgnoreCase(trimmed)
                    || role.name().equals(trimmed.toUpperCase(Locale.ROOT).replace(' ', '_'))) {
                return role;
            }
        }
        throw new ValidationException("Unknown actor role: " + value, "role", value);
    }
}
