package com.gitcli.command;

import java.util.List;

/**
 * Argument guards shared by the commands. A revision starting with {@code -} would be read by git
 * as an option, so it is rejected before anything is spawned.
 */
final class GitArguments {
    static final String END_OF_OPTIONS = "--";

    private GitArguments() {
    }

    static String requireRevision(String what, String value) {
        if (value != null && value.startsWith("-")) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + value + "'");
        }
        return value;
    }

    static void requireRevisions(String what, List<String> values) {
        for (String value : values) {
            requireRevision(what, value);
        }
    }

    /** Appends {@code --} and the pathspecs, or nothing when there are none. */
    static void appendPathspecs(List<String> args, List<String> pathspecs) {
        if (pathspecs == null || pathspecs.isEmpty()) {
            return;
        }
        args.add(END_OF_OPTIONS);
        args.addAll(pathspecs);
    }

    /**
     * Adds {@code flag} when {@code value} is an empty string and {@code flag=value} when it is
     * non-empty; {@code null} leaves the option off.
     */
    static void appendOptional(List<String> args, String flag, String value) {
        if (value == null) {
            return;
        }
        args.add(value.isEmpty() ? flag : flag + "=" + value);
    }

    /** {@code --flag} for true, {@code --no-flag} for false, nothing for {@code null}. */
    static void appendNegatable(List<String> args, String name, Boolean value) {
        if (value != null) {
            args.add(value ? "--" + name : "--no-" + name);
        }
    }
}
