package com.gitcli.exec;

import java.io.IOException;

/**
 * Root of the errors raised while executing git.
 */
public class GitException extends IOException {
    public GitException(String message) {
        super(message);
    }

    public GitException(String message, Throwable cause) {
        super(message, cause);
    }
}
