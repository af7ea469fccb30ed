package com.gitcli.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Per-path status keyed by path, plus the ignored paths when they were requested. Once merged with
 * the index through {@link #withIndex(Collection)} it holds every tracked and untracked path, in index
 * order followed by the paths only the status report knows about.
 */
public record StatusReport(Map<String, StatusEntry> entries, List<String> ignored) {
    public StatusReport {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        ignored = List.copyOf(ignored);
    }

    /** Seeds clean entries for indexed paths, then lays this report's entries over them. */
    public StatusReport withIndex(Collection<StatusEntry> indexEntries) {
        Map<String, StatusEntry> merged = new LinkedHashMap<>();
        for (StatusEntry entry : indexEntries) {
            merged.put(entry.path(), entry);
        }
        merged.putAll(entries);
        return new StatusReport(merged, ignored);
    }

    public StatusEntry get(String path) {
        return entries.get(path);
    }

    public boolean contains(String path) {
        return entries.containsKey(path);
    }

    public int size() {
        return entries.size();
    }

    public Map<String, StatusEntry> changed() {
        return select(entry -> "M".equals(entry.type()));
    }

    public Map<String, StatusEntry> added() {
        return select(entry -> "A".equals(entry.type()));
    }

    public Map<String, StatusEntry> deleted() {
        return select(entry -> "D".equals(entry.type()));
    }

    public Map<String, StatusEntry> untracked() {
        return select(StatusEntry::untracked);
    }

    private Map<String, StatusEntry> select(Predicate<StatusEntry> predicate) {
        Map<String, StatusEntry> selected = new LinkedHashMap<>();
        entries.forEach((path, entry) -> {
            if (predicate.test(entry)) {
                selected.put(path, entry);
            }
        });
        return selected;
    }
}
