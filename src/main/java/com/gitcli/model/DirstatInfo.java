package com.gitcli.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-directory change percentages in the order git emitted them. No re-aggregation is done here.
 */
public record DirstatInfo(List<DirstatEntry> entries) {
    public DirstatInfo {
        entries = List.copyOf(entries);
    }

    public Optional<Double> percentOf(String directory) {
        return entries.stream()
                .filter(entry -> entry.directory().equals(directory))
                .map(DirstatEntry::percent)
                .findFirst();
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (DirstatEntry entry : entries) {
            map.put(entry.directory(), entry.percent());
        }
        return map;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
