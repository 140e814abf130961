package com.stage.composition.changelog;

import com.stage.composition.core.model.CommitEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Commit history read back from the change-log layer.
 *
 * @param commits entries by id, in document order
 * @param roots   ids of entries whose parent is absent or not in the history
 */
public record CommitHistory(Map<String, CommitEntry> commits, List<String> roots) {

    public CommitHistory {
        commits = Collections.unmodifiableMap(new LinkedHashMap<>(commits != null ? commits : Map.of()));
        roots = roots != null ? List.copyOf(roots) : List.of();
    }

    public static CommitHistory empty() {
        return new CommitHistory(Map.of(), List.of());
    }

    /**
     * Builds a history from entries, deriving the roots.
     */
    public static CommitHistory of(List<CommitEntry> entries) {
        Map<String, CommitEntry> byId = new LinkedHashMap<>();
        for (CommitEntry entry : entries) {
            byId.put(entry.id(), entry);
        }
        List<String> roots = byId.values().stream()
                .filter(e -> e.parentId() == null || !byId.containsKey(e.parentId()))
                .map(CommitEntry::id)
                .collect(Collectors.toList());
        return new CommitHistory(byId, roots);
    }

    public Optional<CommitEntry> get(String id) {
        return Optional.ofNullable(commits.get(id));
    }

    public int size() {
        return commits.size();
    }

    public boolean isEmpty() {
        return commits.isEmpty();
    }

    /**
     * Entries ordered by sequence number, oldest first.
     */
    public List<CommitEntry> ordered() {
        return commits.values().stream()
                .sorted(Comparator.comparingLong(CommitEntry::sequence))
                .collect(Collectors.toList());
    }

    /**
     * The entry with the highest sequence number.
     */
    public Optional<CommitEntry> latest() {
        return commits.values().stream().max(Comparator.comparingLong(CommitEntry::sequence));
    }

    /**
     * Follows parent links from the given entry back to its root, newest first.
     * Stops at a missing parent or a cycle.
     */
    public List<CommitEntry> lineage(String id) {
        List<CommitEntry> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        CommitEntry current = commits.get(id);
        while (current != null && seen.add(current.id())) {
            chain.add(current);
            current = current.parentId() != null ? commits.get(current.parentId()) : null;
        }
        return chain;
    }
}
