package com.gitcli.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Objects reported by {@code git fsck}, grouped by category.
 *
 * <p>{@code dangling}, {@code missing}, {@code unreachable} and {@code warnings} are issues;
 * {@code root} and {@code tagged} are informational and never count towards {@link #anyIssues()}.
 */
public record FsckResult(
        List<FsckObject> dangling,
        List<FsckObject> missing,
        List<FsckObject> unreachable,
        List<FsckObject> warnings,
        List<FsckObject> root,
        List<FsckObject> tagged) {

    public FsckResult {
        dangling = List.copyOf(dangling);
        missing = List.copyOf(missing);
        unreachable = List.copyOf(unreachable);
        warnings = List.copyOf(warnings);
        root = List.copyOf(root);
        tagged = List.copyOf(tagged);
    }

    public static FsckResult empty() {
        return new FsckResult(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public boolean anyIssues() {
        return !dangling.isEmpty() || !missing.isEmpty() || !unreachable.isEmpty() || !warnings.isEmpty();
    }

    public List<FsckObject> allObjects() {
        List<FsckObject> all = new ArrayList<>(dangling);
        all.addAll(missing);
        all.addAll(unreachable);
        all.addAll(warnings);
        return all;
    }

    public int count() {
        return allObjects().size();
    }

    /** True when there are no issues; informational root and tagged objects are ignored. */
    public boolean isEmpty() {
        return !anyIssues();
    }
}
