package com.stage.composition.security;

import java.util.Objects;

/**
 * Who is acting: the identity compared against layer owners, and the role it acts under.
 *
 * @param identity acting identity, compared with {@code Layer#getOwner()}
 * @param role     role the identity acts under
 */
public record StageContext(String identity, ActorRole role) {

    public StageContext {
        Objects.requireNonNull(identity, "identity is required");
        Objects.requireNonNull(role, "role is required");
    }

    public static StageContext of(String identity, ActorRole role) {
        return new StageContext(identity, role);
    }

    /**
     * Context whose identity is the role's display name, for single-user setups
     * where actors are known only by role.
     */
    public static StageContext forRole(ActorRole role) {
        return new StageContext(role.displayName(), role);
    }

    public boolean isPrivileged() {
        return role.isPrivileged();
    }

    /**
     * Returns true if a layer with this owner is hidden from this actor.
     * Unowned layers are visible to everyone.
     */
    public boolean isHiddenOwner(String owner) {
        return !isPrivileged() && owner != null && !owner.isBlank() && !owner.equals(identity);
    }
}
