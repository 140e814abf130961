package com.stage.composition.conflict;

import com.stage.composition.core.model.Layer;
import com.stage.composition.core.model.Prim;
import com.stage.composition.layer.LayerStack;
import com.stage.composition.security.ActorRole;
import com.stage.composition.security.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Gates property edits by role and layer ownership.
 */
public class PermissionChecker {
    private static final Logger log = LoggerFactory.getLogger(PermissionChecker.class);

    public PermissionDecision checkPermission(Prim prim, boolean historyMode, LayerStack stack, StageContext context) {
        PermissionDecision decision = decide(prim, historyMode, stack, context);
        if (decision.isDenied()) {
            log.info("permission.denied path={} identity={} role={} reason=\"{}\"",
                    prim.getPath(), context.identity(), context.role(), decision.reason());
        }
        return decision;
    }

    private PermissionDecision decide(Prim prim, boolean historyMode, LayerStack stack, StageContext context) {
        if (historyMode) {
            return PermissionDecision.deny("History mode is read-only");
        }
        ActorRole role = context.role();
        if (role.hasFullEditAccess()) {
            return PermissionDecision.allow(role.displayName() + " has full edit access");
        }
        if (role.isReadOnly()) {
            return PermissionDecision.deny(role.displayName() + " has read-only access");
        }

        Optional<Layer> layer = prim.getProvenance().flatMap(p -> stack.find(p.sourceFile()));
        if (layer.isEmpty() || !layer.get().isOwned()) {
            return PermissionDecision.allow("No ownership restrictions");
        }
        String owner = layer.get().getOwner();
        if (owner.equals(context.identity())) {
            return PermissionDecision.allow("You own this layer");
        }
        return PermissionDecision.deny("This property is owned by " + owner
                + ". Only the owner or " + ActorRole.PROJECT_MANAGER.displayName() + " can modify it.");
    }
}
