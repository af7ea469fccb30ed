package com.gitcli.exec;

import java.io.IOException;

/**
 * A caller-supplied output sink failed while receiving git output. The invocation was aborted and
 * {@link #result()} holds what had been captured up to that point.
 */
public class ProcessIOException extends GitException {
    private final transient GitCommandResult result;

    public ProcessIOException(String message, GitCommandResult result, IOException cause) {
        super(message, cause);
        this.result = result;
    }

    public GitCommandResult result() {
        return result;
    }
}
