package com.stage.composition.layer;

/**
 * Listener for layer stack mutations. Implementations can react to changes,
 * e.g., by invalidating a cached composition.
 */
public interface LayerStackListener {

    /**
     * Called after the stack was mutated.
     *
     * @param filePath layer affected, or null when the change concerns the whole stack
     * @param type     kind of change
     */
    void onLayerStackChanged(String filePath, LayerChangeType type);
}
