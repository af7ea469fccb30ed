package com.gitcli.exec;

/**
 * Inclusive range of exit codes a git command treats as success. {@code git diff} exits 1 when
 * there are differences and {@code git fsck} reports findings through bits of its exit code.
 */
public record ExitCodePolicy(int lowest, int highest) {
    public static final ExitCodePolicy ZERO_ONLY = new ExitCodePolicy(0, 0);
    public static final ExitCodePolicy DIFF = new ExitCodePolicy(0, 1);
    /*
     * fsck ORs finding bits into its exit code: 1 for broken objects, 2 for missing reachable objects,
     * 4 for pack errors. Any mix of those still prints a full report; bits from 8 up (refs, commit-graph,
     * multi-pack-index) and 128 are failures.
     */
    public static final ExitCodePolicy FSCK = new ExitCodePolicy(0, 7);

    public ExitCodePolicy {
        if (lowest < 0 || highest < lowest) {
            throw new IllegalArgumentException("Invalid exit code range " + lowest + ".." + highest);
        }
    }

    public boolean accepts(int exitCode) {
        return exitCode >= lowest && exitCode <= highest;
    }

    /** Throws {@link FailedException} when {@code result} exited with a code outside the range. */
    public GitCommandResult check(GitCommandResult result) throws FailedException {
        if (result.exitStatus() instanceof ExitStatus.Exited exited && !accepts(exited.code())) {
            throw new FailedException(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return lowest + ".." + highest;
    }
}
