package com.gitcli.command;

import java.util.List;

/**
 * Options shared by the diff commands.
 *
 * <p>{@code findRenames}, {@code findCopies} and {@code dirstat} take {@code null} to leave the
 * option off, an empty string for the bare flag, or a value such as {@code 50%} or
 * {@code lines,cumulative}.
 */
public record DiffOptions(
        String commit1,
        String commit2,
        boolean cached,
        boolean mergeBase,
        boolean noIndex,
        String findRenames,
        String findCopies,
        boolean findCopiesHarder,
        String dirstat,
        List<String> pathspecs) {

    public DiffOptions {
        GitArguments.requireRevision("commit or commit range", commit1);
        GitArguments.requireRevision("commit or commit range", commit2);
        if (commit2 != null && commit1 == null) {
            throw new IllegalArgumentException("commit2 requires commit1");
        }
        if (cached && noIndex) {
            throw new IllegalArgumentException("cached and noIndex cannot be combined");
        }
        pathspecs = pathspecs == null ? List.of() : List.copyOf(pathspecs);
    }

    public static DiffOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    void appendTo(List<String> args) {
        if (cached) {
            args.add("--cached");
        }
        if (mergeBase) {
            args.add("--merge-base");
        }
        if (noIndex) {
            args.add("--no-index");
        }
        GitArguments.appendOptional(args, "--find-renames", findRenames);
        GitArguments.appendOptional(args, "--find-copies", findCopies);
        if (findCopiesHarder) {
            args.add("--find-copies-harder");
        }
        GitArguments.appendOptional(args, "--dirstat", dirstat);
        if (commit1 != null) {
            args.add(commit1);
        }
        if (commit2 != null) {
            args.add(commit2);
        }
        GitArguments.appendPathspecs(args, pathspecs);
    }

    public static final class Builder {
        private String commit1;
        private String commit2;
        private boolean cached;
        private boolean mergeBase;
        private boolean noIndex;
        private String findRenames;
        private String findCopies;
        private boolean findCopiesHarder;
        private String dirstat;
        private List<String> pathspecs = List.of();

        private Builder() {
        }

        public Builder commit1(String commit1) {
            this.commit1 = commit1;
            return this;
        }

        public Builder commit2(String commit2) {
            this.commit2 = commit2;
            return this;
        }

        public Builder cached(boolean cached) {
            this.cached = cached;
            return this;
        }

        public Builder mergeBase(boolean mergeBase) {
            this.mergeBase = mergeBase;
            return this;
        }

        public Builder noIndex(boolean noIndex) {
            this.noIndex = noIndex;
            return this;
        }

        public Builder findRenames(String findRenames) {
            this.findRenames = findRenames;
            return this;
        }

        public Builder findCopies(String findCopies) {
            this.findCopies = findCopies;
            return this;
        }

        public Builder findCopiesHarder(boolean findCopiesHarder) {
            this.findCopiesHarder = findCopiesHarder;
            return this;
        }

        public Builder dirstat(String dirstat) {
            this.dirstat = dirstat;
            return this;
        }

        public Builder pathspecs(List<String> pathspecs) {
            this.pathspecs = pathspecs;
            return this;
        }

        public DiffOptions build() {
            return new DiffOptions(commit1, commit2, cached, mergeBase, noIndex, findRenames, findCopies,
                    findCopiesHarder, dirstat, pathspecs);
        }
    }
}
