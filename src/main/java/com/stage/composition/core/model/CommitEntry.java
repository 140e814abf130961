package com.stage.composition.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable record of one change-log entry.
 * Entries are linked through {@code parentId} into a linear history.
 */
public record CommitEntry(
        String id,
        long sequence,
        Instant timestamp,
        String author,
        String type,
        String message,
        String status,
        String parentId,
        List<String> affectedPaths,
        String fileName,
        String referencePath,
        String contentHash,
        long fileSize,
        String sourceStatus,
        String targetStatus,
        String oldName,
        String newName,
        String oldPath,
        String newPath,
        String entityType,
        List<Prim> prims
) {
    public static final String TYPE_COMMIT = "Commit";
    public static final String TYPE_PROMOTION = "Promotion";
    public static final String TYPE_OBJECT_PROMOTION = "Object Promotion";
    public static final String TYPE_RENAME = "Rename";

    public CommitEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        affectedPaths = affectedPaths != null ? List.copyOf(affectedPaths) : List.of();
        prims = prims != null ? List.copyOf(prims) : List.of();
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parentId);
    }

    public boolean isRename() {
        return TYPE_RENAME.equals(type);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CommitEntry entry) {
        return new Builder()
                .id(entry.id)
                .sequence(entry.sequence)
                .timestamp(entry.timestamp)
                .author(entry.author)
                .type(entry.type)
                .message(entry.message)
                .status(entry.status)
                .parentId(entry.parentId)
                .affectedPaths(entry.affectedPaths)
                .fileName(entry.fileName)
                .referencePath(entry.referencePath)
                .contentHash(entry.contentHash)
                .fileSize(entry.fileSize)
                .sourceStatus(entry.sourceStatus)
                .targetStatus(entry.targetStatus)
                .oldName(entry.oldName)
                .newName(entry.newName)
                .oldPath(entry.oldPath)
                .newPath(entry.newPath)
                .entityType(entry.entityType)
                .prims(entry.prims);
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private long sequence;
        private Instant timestamp = Instant.now();
        private String author;
        private String type = TYPE_COMMIT;
        private String message;
        private String status;
        private String parentId;
        private List<String> affectedPaths;
        private String fileName;
        private String referencePath;
        private String contentHash;
        private long fileSize;
        private String sourceStatus;
        private String targetStatus;
        private String oldName;
        private String newName;
        private String oldPath;
        private String newPath;
        private String entityType;
        private List<Prim> prims;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder affectedPaths(List<String> affectedPaths) {
            this.affectedPaths = affectedPaths;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder referencePath(String referencePath) {
            this.referencePath = referencePath;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder fileSize(long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public Builder sourceStatus(String sourceStatus) {
            this.sourceStatus = sourceStatus;
            return this;
        }

        public Builder targetStatus(String targetStatus) {
            this.targetStatus = targetStatus;
            return this;
        }

        public Builder oldName(String oldName) {
            this.oldName = oldName;
            return this;
        }

        public Builder newName(String newName) {
            this.newName = newName;
            return this;
        }

        public Builder oldPath(String oldPath) {
            this.oldPath = oldPath;
            return this;
        }

        public Builder newPath(String newPath) {
            this.newPath = newPath;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder prims(List<Prim> prims) {
            this.prims = prims;
            return this;
        }

        public CommitEntry build() {
            return new CommitEntry(id, sequence, timestamp, author, type, message, status, parentId,
                    affectedPaths, fileName, referencePath, contentHash, fileSize, sourceStatus,
                    targetStatus, oldName, newName, oldPath, newPath, entityType, prims);
        }
    }
}
