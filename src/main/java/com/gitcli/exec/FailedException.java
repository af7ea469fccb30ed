package com.gitcli.exec;

/** git exited normally with a code the command's {@link ExitCodePolicy} does not accept. */
public class FailedException extends CommandLineException {
    public FailedException(GitCommandResult result) {
        super(result);
    }

    @Override
    public Kind kind() {
        return Kind.FAILED;
    }
}
