package com.stage.composition.conflict;

import java.util.List;
import java.util.Objects;

/**
 * One detected conflict for a prospective property change.
 *
 * @param type         kind of conflict
 * @param source       where the competing opinion lives: {@code layer}, {@code statement} or {@code multiple_layers}
 * @param file         layer file holding the competing opinion, null for multi-layer conflicts
 * @param owner        owner of that layer, or one of the {@code unknown} / {@code staged changes} sentinels
 * @param currentValue competing value, null for multi-layer conflicts
 * @param layers       every defining layer, for multi-layer conflicts only
 */
public record Conflict(
        ConflictType type,
        String source,
        String file,
        String owner,
        String currentValue,
        List<LayerDefinition> layers
) {
    public static final String UNKNOWN_OWNER = "unknown";
    public static final String STAGED_OWNER = "staged changes";

    public Conflict {
        Objects.requireNonNull(type, "type is required");
        layers = layers != null ? List.copyOf(layers) : List.of();
    }

    /**
     * A layer declaring the contested property.
     */
    public record LayerDefinition(String file, String owner, String value) {
    }
}
