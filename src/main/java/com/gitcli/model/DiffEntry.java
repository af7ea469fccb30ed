package com.gitcli.model;

import java.util.Objects;

/**
 * A single file-level change reported by git.
 *
 * <p>{@code src} is absent for added entries and {@code dst} is absent for deleted entries. Unmerged
 * entries may carry neither side, which is why {@code path} is stored rather than derived.
 *
 * @param status     the one change kind this entry represents
 * @param path       the destination path, or the source path when there is no destination
 * @param src        the pre-image side, or {@code null}
 * @param dst        the post-image side, or {@code null}
 * @param srcPath    the original path of a rename or copy when it differs from {@code path}
 * @param similarity rename/copy similarity score in {@code [1, 100]}, {@code null} for other statuses
 * @param insertions added lines, always 0 for binary entries
 * @param deletions  removed lines, always 0 for binary entries
 * @param binary     whether git reported the content as binary
 * @param patch      the unified diff text for this file when parsed from a patch listing
 */
public record DiffEntry(
        DiffStatus status,
        String path,
        FileRef src,
        FileRef dst,
        String srcPath,
        Integer similarity,
        int insertions,
        int deletions,
        boolean binary,
        String patch) {

    public DiffEntry {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(path, "path");
        if (insertions < 0 || deletions < 0) {
            throw new IllegalArgumentException("insertions and deletions must be >= 0 for " + path);
        }
        if (binary && (insertions != 0 || deletions != 0)) {
            throw new IllegalArgumentException("binary entry must not carry line counts: " + path);
        }
        if (similarity != null) {
            if (!status.carriesSimilarity()) {
                throw new IllegalArgumentException("similarity is only defined for renames and copies: " + path);
            }
            if (similarity < 1 || similarity > 100) {
                throw new IllegalArgumentException("similarity must be within [1, 100] but was " + similarity);
            }
        }
        if (srcPath != null && (!status.carriesSimilarity() || srcPath.equals(path))) {
            srcPath = null;
        }
    }

    public boolean isModified() {
        return status == DiffStatus.MODIFIED;
    }

    public boolean isAdded() {
        return status == DiffStatus.ADDED;
    }

    public boolean isDeleted() {
        return status == DiffStatus.DELETED;
    }

    public boolean isRenamed() {
        return status == DiffStatus.RENAMED;
    }

    public boolean isCopied() {
        return status == DiffStatus.COPIED;
    }

    public boolean isTypeChanged() {
        return status == DiffStatus.TYPE_CHANGED;
    }

    public boolean isUnmerged() {
        return status == DiffStatus.UNMERGED;
    }

    public boolean isSubmodule() {
        return (src != null && src.isSubmodule()) || (dst != null && dst.isSubmodule());
    }
}
