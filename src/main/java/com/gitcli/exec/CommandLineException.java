package com.gitcli.exec;

/**
 * A git invocation that ran but did not end successfully. The {@link #kind()} tag lets callers
 * switch over the failure instead of testing subclasses.
 */
public abstract class CommandLineException extends GitException {
    public enum Kind {
        FAILED,
        SIGNALED,
        TIMED_OUT
    }

    private final transient GitCommandResult result;

    protected CommandLineException(GitCommandResult result) {
        this(result, describe(result));
    }

    protected CommandLineException(GitCommandResult result, String message) {
        super(message);
        this.result = result;
    }

    public GitCommandResult result() {
        return result;
    }

    public abstract Kind kind();

    static String describe(GitCommandResult result) {
        return result.command() + ", status: " + result.exitStatus() + ", stderr: " + quote(result.stderr());
    }

    private static String quote(String text) {
        StringBuilder quoted = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }
}
