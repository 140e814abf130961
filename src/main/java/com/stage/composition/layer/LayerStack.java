package com.stage.composition.layer;

import com.stage.composition.core.PrimNameValidator;
import com.stage.composition.core.ValidationException;
import com.stage.composition.core.model.Layer;
import com.stage.composition.core.model.LayerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered set of layers, weakest first. A layer later in the stack overrides earlier ones.
 * Every mutation is reported to registered {@link LayerStackListener}s.
 */
public class LayerStack {
    private static final Logger log = LoggerFactory.getLogger(LayerStack.class);

    /** Status filter token matching every layer. */
    public static final String ALL = "All";

    private final List<Layer> layers = new ArrayList<>();
    private final List<LayerStackListener> listeners = new ArrayList<>();

    public LayerStack() {
    }

    public LayerStack(List<Layer> initial) {
        validate(initial);
        layers.addAll(initial);
    }

    /**
     * Creates a layer with status {@code WIP}. The layer is not added to any stack.
     *
     * @throws ValidationException if the file path is missing
     */
    public static Layer createLayer(String filePath) {
        return createLayer(filePath, LayerStatus.DRAFT);
    }

    /**
     * Creates a layer from a status token ({@code WIP}, {@code Shared}, {@code Published}, {@code Archived}).
     *
     * @throws ValidationException if the file path is missing or the token is not a status
     */
    public static Layer createLayer(String filePath, String statusToken) {
        PrimNameValidator.validateFilePath(filePath);
        LayerStatus status = statusToken == null ? LayerStatus.DRAFT : LayerStatus.fromToken(statusToken);
        return createLayer(filePath, status);
    }

    public static Layer createLayer(String filePath, LayerStatus status) {
        PrimNameValidator.validateFilePath(filePath);
        return Layer.builder()
                .filePath(filePath)
                .status(status != null ? status : LayerStatus.DRAFT)
                .visible(true)
                .build();
    }

    /**
     * Checks a list of layers for duplicate file paths.
     *
     * @throws ValidationException if the list is null or a file path occurs more than once
     */
    public static void validate(List<Layer> candidate) {
        if (candidate == null) {
            throw new ValidationException("Layer stack must not be null", "layerStack", null);
        }
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Layer layer : candidate) {
            if (!seen.add(layer.getFilePath())) {
                duplicates.add(layer.getFilePath());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new ValidationException(
                    "Duplicate layers found: " + String.join(", ", duplicates), "layerStack", duplicates);
        }
    }

    public void addListener(LayerStackListener listener) {
        listeners.add(listener);
    }

    public void removeListener(LayerStackListener listener) {
        listeners.remove(listener);
    }

    /**
     * Appends a layer as the strongest opinion.
     *
     * @throws ValidationException if a layer with the same file path is already present
     */
    public Layer add(Layer layer) {
        List<Layer> candidate = new ArrayList<>(layers);
        candidate.add(layer);
        validate(candidate);
        layers.add(layer);
        log.info("layer.added filePath={} status={} owner={}", layer.getFilePath(),
                layer.getStatus().token(), layer.getOwner());
        fire(layer.getFilePath(), LayerChangeType.ADDED);
        return layer;
    }

    public boolean remove(String filePath) {
        boolean removed = layers.removeIf(l -> l.getFilePath().equals(filePath));
        if (removed) {
            log.info("layer.removed filePath={}", filePath);
            fire(filePath, LayerChangeType.REMOVED);
        }
        return removed;
    }

    public Optional<Layer> find(String filePath) {
        return layers.stream().filter(l -> l.getFilePath().equals(filePath)).findFirst();
    }

    /**
     * @throws ValidationException if no layer has this file path
     */
    public Layer get(String filePath) {
        return find(filePath).orElseThrow(() ->
                new ValidationException("Layer not found: " + filePath, "filePath", filePath));
    }

    public boolean contains(String filePath) {
        return find(filePath).isPresent();
    }

    public int indexOf(String filePath) {
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i).getFilePath().equals(filePath)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Moves a layer one step forward in the status workflow; {@code Archived} stays {@code Archived}.
     *
     * @return the new status
     */
    public LayerStatus promote(String filePath) {
        Layer layer = get(filePath);
        return changeStatus(layer, layer.getStatus().next());
    }

    /**
     * Moves a layer one step back in the status workflow; {@code WIP} stays {@code WIP}.
     *
     * @return the new status
     */
    public LayerStatus demote(String filePath) {
        Layer layer = get(filePath);
        return changeStatus(layer, layer.getStatus().previous());
    }

    public void setVisible(String filePath, boolean visible) {
        Layer layer = get(filePath);
        if (layer.isVisible() != visible) {
            layer.setVisible(visible);
            log.debug("layer.visibility filePath={} visible={}", filePath, visible);
            fire(filePath, LayerChangeType.UPDATED);
        }
    }

    public boolean toggleVisibility(String filePath) {
        boolean visible = !get(filePath).isVisible();
        setVisible(filePath, visible);
        return visible;
    }

    /**
     * Assigns an owner; null makes the layer unowned.
     */
    public void setOwner(String filePath, String owner) {
        Layer layer = get(filePath);
        layer.setOwner(owner);
        log.debug("layer.owner filePath={} owner={}", filePath, owner);
        fire(filePath, LayerChangeType.UPDATED);
    }

    /**
     * Moves the layer at {@code fromIndex} to {@code toIndex}.
     *
     * @throws ValidationException if either index is out of bounds
     */
    public void reorder(int fromIndex, int toIndex) {
        if (fromIndex < 0 || fromIndex >= layers.size()) {
            throw new ValidationException("Invalid from index", "fromIndex", fromIndex);
        }
        if (toIndex < 0 || toIndex >= layers.size()) {
            throw new ValidationException("Invalid to index", "toIndex", toIndex);
        }
        Layer moved = layers.remove(fromIndex);
        layers.add(toIndex, moved);
        log.debug("layer.reordered filePath={} from={} to={}", moved.getFilePath(), fromIndex, toIndex);
        fire(moved.getFilePath(), LayerChangeType.REORDERED);
    }

    /**
     * All layers, weakest first (immutable view).
     */
    public List<Layer> getLayers() {
        return Collections.unmodifiableList(new ArrayList<>(layers));
    }

    public List<Layer> visibleLayers() {
        return layers.stream().filter(Layer::isVisible).collect(Collectors.toList());
    }

    /**
     * Filters by status token; {@code All} returns every layer.
     *
     * @throws ValidationException if the token is neither {@code All} nor a status
     */
    public List<Layer> filterByStatus(String statusToken) {
        if (ALL.equalsIgnoreCase(statusToken)) {
            return getLayers();
        }
        return filterByStatus(LayerStatus.fromToken(statusToken));
    }

    public List<Layer> filterByStatus(LayerStatus status) {
        return layers.stream().filter(l -> l.getStatus() == status).collect(Collectors.toList());
    }

    /**
     * Layers that a single promotion would bring to the target status.
     */
    public List<Layer> promotableTo(LayerStatus target) {
        if (target == LayerStatus.DRAFT) {
            return List.of();
        }
        return filterByStatus(target.previous());
    }

    public int size() {
        return layers.size();
    }

    public boolean isEmpty() {
        return layers.isEmpty();
    }

    private LayerStatus changeStatus(Layer layer, LayerStatus target) {
        LayerStatus previous = layer.getStatus();
        if (previous == target) {
            log.debug("layer.status.unchanged filePath={} status={}", layer.getFilePath(), previous.token());
            return previous;
        }
        layer.setStatus(target);
        log.info("layer.status.changed filePath={} from={} to={}",
                layer.getFilePath(), previous.token(), target.token());
        fire(layer.getFilePath(), LayerChangeType.STATUS_CHANGED);
        return target;
    }

    private void fire(String filePath, LayerChangeType type) {
        for (LayerStackListener listener : List.copyOf(listeners)) {
            listener.onLayerStackChanged(filePath, type);
        }
    }
}
