package com.gitcli.model;

import java.util.List;

public record NumstatResult(
        List<NumstatEntry> entries,
        int totalInsertions,
        int totalDeletions,
        int filesChanged,
        Shortstat shortstat,
        DirstatInfo dirstat) {

    public NumstatResult {
        entries = List.copyOf(entries);
    }

    public static NumstatResult of(List<NumstatEntry> entries, Shortstat shortstat, DirstatInfo dirstat) {
        return new NumstatResult(
                entries,
                entries.stream().mapToInt(NumstatEntry::insertions).sum(),
                entries.stream().mapToInt(NumstatEntry::deletions).sum(),
                entries.size(),
                shortstat,
                dirstat);
    }
}
