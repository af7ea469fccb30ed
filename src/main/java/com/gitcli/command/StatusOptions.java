package com.gitcli.command;

import java.util.List;

/**
 * @param untrackedFiles {@code all}, {@code normal} or {@code no}
 * @param ignored        also report ignored files
 */
public record StatusOptions(String untrackedFiles, boolean ignored, List<String> pathspecs) {
    private static final List<String> UNTRACKED_MODES = List.of("all", "normal", "no");

    public StatusOptions {
        untrackedFiles = untrackedFiles == null ? "all" : untrackedFiles;
        if (!UNTRACKED_MODES.contains(untrackedFiles)) {
            throw new IllegalArgumentException("untrackedFiles must be one of " + UNTRACKED_MODES
                    + ": '" + untrackedFiles + "'");
        }
        pathspecs = pathspecs == null ? List.of() : List.copyOf(pathspecs);
    }

    public static StatusOptions defaults() {
        return new StatusOptions("all", false, List.of());
    }

    public StatusOptions withPathspecs(List<String> newPathspecs) {
        return new StatusOptions(untrackedFiles, ignored, newPathspecs);
    }

    public StatusOptions withIgnored(boolean includeIgnored) {
        return new StatusOptions(untrackedFiles, includeIgnored, pathspecs);
    }
}
