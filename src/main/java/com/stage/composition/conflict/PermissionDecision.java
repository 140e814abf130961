package com.stage.composition.conflict;

/**
 * Outcome of a permission check, with a human-readable reason either way.
 */
public record PermissionDecision(boolean allowed, String reason) {

    public static PermissionDecision allow(String reason) {
        return new PermissionDecision(true, reason);
    }

    public static PermissionDecision deny(String reason) {
        return new PermissionDecision(false, reason);
    }

    public boolean isDenied() {
        return !allowed;
    }
}
