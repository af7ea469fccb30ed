package com.gitcli.exec;

/** git was terminated by a signal it did not handle. */
public class SignaledException extends CommandLineException {
    public SignaledException(GitCommandResult result) {
        super(result);
    }

    protected SignaledException(GitCommandResult result, String message) {
        super(result, message);
    }

    @Override
    public Kind kind() {
        return Kind.SIGNALED;
    }
}
