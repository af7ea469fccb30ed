package com.gitcli.model;

import java.util.List;

/**
 * Ordered file changes for one diff invocation.
 *
 * <p>Totals always equal the sums over {@code entries} and {@code filesChanged} always equals the
 * entry count. {@code shortstat} is git's own summary line when it was requested and may differ from
 * the entry count for listings where git splits one change into two entries. {@code dirstat} is only
 * present when requested.
 */
public record DiffResult(
        List<DiffEntry> entries,
        int totalInsertions,
        int totalDeletions,
        int filesChanged,
        Shortstat shortstat,
        DirstatInfo dirstat) {

    public DiffResult {
        entries = List.copyOf(entries);
        int insertions = entries.stream().mapToInt(DiffEntry::insertions).sum();
        int deletions = entries.stream().mapToInt(DiffEntry::deletions).sum();
        if (totalInsertions != insertions || totalDeletions != deletions || filesChanged != entries.size()) {
            throw new IllegalArgumentException("diff totals do not match entries: insertions=" + totalInsertions
                    + "/" + insertions + " deletions=" + totalDeletions + "/" + deletions
                    + " files=" + filesChanged + "/" + entries.size());
        }
    }

    public static DiffResult of(List<DiffEntry> entries, Shortstat shortstat, DirstatInfo dirstat) {
        return new DiffResult(
                entries,
                entries.stream().mapToInt(DiffEntry::insertions).sum(),
                entries.stream().mapToInt(DiffEntry::deletions).sum(),
                entries.size(),
                shortstat,
                dirstat);
    }

    public static DiffResult empty() {
        return of(List.of(), null, null);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
