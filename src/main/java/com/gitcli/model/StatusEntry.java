package com.gitcli.model;

import java.util.Objects;

/**
 * Status of one path as encoded by a porcelain v2 status report.
 *
 * <p>The index and repo fields hold exactly what the report printed. A side that does not exist is
 * printed by git as an all-zero mode and object id, and those zeros are kept as-is; {@code null}
 * only means the report line carried no such field at all (untracked paths). A path that was staged
 * as new and then deleted from the worktree reports type {@code A} with the staged blob as its index
 * side, which cannot be told apart from a staged addition that is still present in the worktree by
 * these fields alone.
 *
 * <p>Paths the report does not mention come from the index listing: they carry the index side and
 * stage only, with no type and no repo side.
 *
 * @param path      the worktree path, unescaped
 * @param type      the single-letter change code, or {@code null} for untracked and clean paths
 * @param stage     the merge stage of the index side, or {@code null} for untracked paths
 * @param untracked whether the path is not tracked
 * @param modeIndex the index mode
 * @param shaIndex  the index object id
 * @param modeRepo  the HEAD mode
 * @param shaRepo   the HEAD object id
 * @param origPath  the source path of a rename or copy
 */
public record StatusEntry(
        String path,
        String type,
        String stage,
        boolean untracked,
        String modeIndex,
        String shaIndex,
        String modeRepo,
        String shaRepo,
        String origPath) {

    public StatusEntry {
        Objects.requireNonNull(path, "path");
    }

    public static StatusEntry clean(String path, String stage, String modeIndex, String shaIndex) {
        return new StatusEntry(path, null, stage, false, modeIndex, shaIndex, null, null, null);
    }

    public static StatusEntry untracked(String path) {
        return new StatusEntry(path, null, null, true, null, null, null, null, null);
    }
}
