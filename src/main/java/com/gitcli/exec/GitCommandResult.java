package com.gitcli.exec;

import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one git invocation.
 *
 * @param command    the argument vector that was executed, binary and global options included
 * @param stdout     captured standard output after decoding and chomping
 * @param stderr     captured standard error, empty when it was merged into stdout
 * @param exitStatus how the process ended
 */
public record GitCommandResult(List<String> command, String stdout, String stderr, ExitStatus exitStatus) {

    public GitCommandResult {
        command = List.copyOf(command);
        Objects.requireNonNull(stdout, "stdout");
        Objects.requireNonNull(stderr, "stderr");
        Objects.requireNonNull(exitStatus, "exitStatus");
    }

    /** The exit code for a normal exit, or -1 when the process was signaled or timed out. */
    public int exitCode() {
        return exitStatus instanceof ExitStatus.Exited exited ? exited.code() : -1;
    }

    public boolean isSuccess() {
        return exitStatus.success();
    }

    public String commandLine() {
        return String.join(" ", command);
    }
}
