package com.stage.composition.resolve;

import com.stage.composition.core.model.Layer;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import com.stage.composition.layer.LayerChangeType;
import com.stage.composition.layer.LayerStack;
import com.stage.composition.layer.LayerStackListener;
import com.stage.composition.security.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * All state one actor composes from: the layer stack, the loaded layer texts, the staged
 * (pre-reference) prims and the cached composition.
 *
 * <p>The cached composition is dropped whenever a text, the stack or the staged prims change.
 * It is also tied to the {@link StageContext} it was composed for, since visibility depends
 * on who is looking.</p>
 */
public class Stage implements LayerStackListener {
    private static final Logger log = LoggerFactory.getLogger(Stage.class);

    private final LayerStack layerStack;
    private final Map<String, String> texts = new LinkedHashMap<>();
    private List<Prim> stagedPrims = new ArrayList<>();

    private ResolutionResult composed;
    private StageContext composedFor;

    public Stage() {
        this(new LayerStack());
    }

    public Stage(LayerStack layerStack) {
        this.layerStack = Objects.requireNonNull(layerStack, "layerStack is required");
        layerStack.addListener(this);
    }

    public LayerStack getLayerStack() {
        return layerStack;
    }

    public Optional<String> getText(String filePath) {
        return Optional.ofNullable(texts.get(filePath));
    }

    /**
     * Loaded texts by file path (immutable view).
     */
    public Map<String, String> getTexts() {
        return Collections.unmodifiableMap(texts);
    }

    public boolean isLoaded(String filePath) {
        return texts.containsKey(filePath);
    }

    public void putText(String filePath, String text) {
        texts.put(filePath, text != null ? text : "");
        invalidate();
    }

    public void removeText(String filePath) {
        if (texts.remove(filePath) != null) {
            invalidate();
        }
    }

    /**
     * Staged roots (immutable view). Use {@link #setStagedPrims(List)} to change them.
     */
    public List<Prim> getStagedPrims() {
        return Collections.unmodifiableList(stagedPrims);
    }

    public void setStagedPrims(List<Prim> prims) {
        this.stagedPrims = new ArrayList<>(prims != null ? prims : List.of());
        invalidate();
    }

    public void addStagedPrim(Prim prim) {
        stagedPrims.add(prim);
        invalidate();
    }

    /**
     * Cached composition for this context, if still valid.
     */
    Optional<ResolutionResult> cachedComposition(StageContext context) {
        if (composed != null && context.equals(composedFor)) {
            return Optional.of(composed);
        }
        return Optional.empty();
    }

    void cacheComposition(StageContext context, ResolutionResult result) {
        this.composed = result;
        this.composedFor = context;
    }

    public boolean hasCachedComposition() {
        return composed != null;
    }

    public void invalidate() {
        if (composed != null) {
            log.debug("stage.cache.invalidated roots={}", composed.roots().size());
        }
        composed = null;
        composedFor = null;
    }

    /**
     * Updates the provenance status of every staged prim that came from the given layer.
     */
    public void syncStatusFromLayer(Layer layer) {
        int[] updated = {0};
        PrimTree.walk(stagedPrims, prim -> prim.getProvenance()
                .filter(p -> p.sourceFile().equals(layer.getFilePath()))
                .ifPresent(p -> {
                    prim.setProvenance(p.withStatus(layer.getStatus()));
                    updated[0]++;
                }));
        log.debug("stage.status.synced filePath={} status={} prims={}",
                layer.getFilePath(), layer.getStatus().token(), updated[0]);
        invalidate();
    }

    @Override
    public void onLayerStackChanged(String filePath, LayerChangeType type) {
        if (type == LayerChangeType.STATUS_CHANGED && filePath != null) {
            layerStack.find(filePath).ifPresent(this::syncStatusFromLayer);
        }
        invalidate();
    }
}
