package com.gitcli.model;

import java.util.Objects;

/**
 * One side of a file-level change: the path, the git file mode and the blob id on that side.
 */
public record FileRef(String path, String mode, String sha) {
    public static final String REGULAR_FILE_MODE = "100644";
    public static final String EXECUTABLE_MODE = "100755";
    public static final String SYMLINK_MODE = "120000";
    public static final String SUBMODULE_MODE = "160000";

    public FileRef {
        Objects.requireNonNull(path, "path");
        mode = mode == null ? "" : mode;
        sha = sha == null ? "" : sha;
    }

    public boolean isRegularFile() {
        return REGULAR_FILE_MODE.equals(mode);
    }

    public boolean isExecutable() {
        return EXECUTABLE_MODE.equals(mode);
    }

    public boolean isSymlink() {
        return SYMLINK_MODE.equals(mode);
    }

    public boolean isSubmodule() {
        return SUBMODULE_MODE.equals(mode);
    }
}
