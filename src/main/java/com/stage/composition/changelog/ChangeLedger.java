package com.stage.composition.changelog;

import com.stage.composition.core.model.CommitEntry;
import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.security.StageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only ledger of commits. Every recorded entry gets the next sequence number and
 * the current head as parent, then becomes the head.
 */
public class ChangeLedger {
    private static final Logger log = LoggerFactory.getLogger(ChangeLedger.class);

    static final String STATUS_NEW = "New";

    private final List<CommitEntry> entries = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private String headId;
    private long lastSequence;

    public ChangeLedger() {
        this(Clock.systemUTC());
    }

    public ChangeLedger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Ledger continuing an existing history: its latest entry is the head.
     */
    public static ChangeLedger continuing(CommitHistory history, Clock clock) {
        ChangeLedger ledger = new ChangeLedger(clock);
        for (CommitEntry entry : history.ordered()) {
            ledger.entries.add(entry);
            ledger.lastSequence = Math.max(ledger.lastSequence, entry.sequence());
        }
        history.latest().ifPresent(e -> ledger.headId = e.id());
        return ledger;
    }

    /**
     * Completes and appends an entry: id, sequence, timestamp, parent and status are
     * assigned here, content hash and size are taken from the affected layer text.
     */
    public synchronized CommitEntry record(CommitEntry.Builder builder, String layerText) {
        Instant now = clock.instant();
        String content = layerText != null ? layerText : "";
        CommitEntry entry = builder
                .id(newId(now))
                .sequence(++lastSequence)
                .timestamp(now)
                .parentId(headId)
                .status(STATUS_NEW)
                .contentHash(sha256(content))
                .fileSize(content.getBytes(StandardCharsets.UTF_8).length)
                .build();
        entries.add(entry);
        headId = entry.id();
        log.info("ledger.recorded id={} type={} sequence={} parent={}",
                entry.id(), entry.type(), entry.sequence(), entry.parentId());
        return entry;
    }

    /**
     * Records staging prims of a layer.
     */
    public CommitEntry recordCommit(StageContext context, String fileName, String layerText, String primPath,
                                    List<String> stagedPaths, LayerStatus sourceStatus, String entityType) {
        String token = sourceStatus != null ? sourceStatus.token() : null;
        return record(CommitEntry.builder()
                .type(CommitEntry.TYPE_COMMIT)
                .author(context.identity())
                .fileName(fileName)
                .referencePath(primPath)
                .affectedPaths(stagedPaths)
                .sourceStatus(token)
                .targetStatus(token)
                .entityType(entityType), layerText);
    }

    /**
     * Records a layer promotion, or an object promotion when {@code objectPath} is set.
     */
    public CommitEntry recordPromotion(StageContext context, String layerPath, String layerText, List<String> paths,
                                       LayerStatus from, LayerStatus to, String objectPath) {
        return record(CommitEntry.builder()
                .type(objectPath != null ? CommitEntry.TYPE_OBJECT_PROMOTION : CommitEntry.TYPE_PROMOTION)
                .author(context.identity())
                .fileName(layerPath)
                .referencePath(objectPath != null ? objectPath : layerPath)
                .affectedPaths(paths)
                .sourceStatus(from.token())
                .targetStatus(to.token()), layerText);
    }

    public CommitEntry recordRename(StageContext context, String fileName, String layerText,
                                    String oldPath, String newPath) {
        return record(CommitEntry.builder()
                .type(CommitEntry.TYPE_RENAME)
                .author(context.identity())
                .fileName(fileName)
                .referencePath(newPath)
                .oldName(lastSegment(oldPath))
                .newName(lastSegment(newPath))
                .oldPath(oldPath)
                .newPath(newPath)
                .affectedPaths(List.of(newPath)), layerText);
    }

    public Optional<String> head() {
        return Optional.ofNullable(headId);
    }

    /**
     * All entries in recording order (immutable view).
     */
    public List<CommitEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<CommitEntry> getEntriesByType(String type) {
        return entries.stream()
                .filter(e -> e.type().equals(type))
                .collect(Collectors.toList());
    }

    public List<CommitEntry> getEntriesByAuthor(String author) {
        return entries.stream()
                .filter(e -> author.equals(e.author()))
                .collect(Collectors.toList());
    }

    /**
     * Entries that staged or referenced the given prim path.
     */
    public List<CommitEntry> getEntriesForPath(String path) {
        return entries.stream()
                .filter(e -> path.equals(e.referencePath()) || e.affectedPaths().contains(path))
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    public CommitHistory toHistory() {
        return CommitHistory.of(entries);
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of the text.
     */
    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String newId(Instant now) {
        return now.toEpochMilli() + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 9);
    }

    private static String lastSegment(String path) {
        if (path == null) {
            return null;
        }
        int idx = path.lastIndexOf('/');
        return idx >= 0 ? path.substring(idx + 1) : path;
    }
}
