package com.stage.composition.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A text document contributing opinions to the stage.
 * Identity is the file path; position in the {@code LayerStack} encodes override strength.
 */
public class Layer {
    private final String filePath;
    private LayerStatus status;
    private String owner;
    private boolean visible;
    private final Instant createdAt;
    private Instant modifiedAt;

    private Layer(Builder builder) {
        this.filePath = builder.filePath;
        this.status = builder.status != null ? builder.status : LayerStatus.DRAFT;
        this.owner = builder.owner;
        this.visible = builder.visible;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.modifiedAt = builder.modifiedAt != null ? builder.modifiedAt : this.createdAt;
    }

    public String getFilePath() {
        return filePath;
    }

    public LayerStatus getStatus() {
        return status;
    }

    public void setStatus(LayerStatus status) {
        this.status = Objects.requireNonNull(status, "status is required");
        this.modifiedAt = Instant.now();
    }

    /**
     * Owning identity, or null when the layer is unowned.
     */
    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
        this.modifiedAt = Instant.now();
    }

    public boolean isOwned() {
        return owner != null && !owner.isBlank();
    }

    public boolean isOwnedBy(String identity) {
        return isOwned() && owner.equals(identity);
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
        this.modifiedAt = Instant.now();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Layer layer = (Layer) o;
        return Objects.equals(filePath, layer.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePath);
    }

    @Override
    public String toString() {
        return "Layer{" +
                "filePath='" + filePath + '\'' +
                ", status=" + status +
                ", owner='" + owner + '\'' +
                ", visible=" + visible +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Layer layer) {
        return new Builder()
                .filePath(layer.filePath)
                .status(layer.status)
                .owner(layer.owner)
                .visible(layer.visible)
                .createdAt(layer.createdAt)
                .modifiedAt(layer.modifiedAt);
    }

    public static class Builder {
        private String filePath;
        private LayerStatus status;
        private String owner;
        private boolean visible = true;
        private Instant createdAt;
        private Instant modifiedAt;

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder status(LayerStatus status) {
            this.status = status;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder modifiedAt(Instant modifiedAt) {
            this.modifiedAt = modifiedAt;
            return this;
        }

        public Layer build() {
            Objects.requireNonNull(filePath, "filePath is required");
            return new Layer(this);
        }
    }
}
