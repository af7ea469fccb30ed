package com.gitcli.exec;

import java.time.Duration;

/** git was still running when its deadline elapsed and was killed. */
public class CommandTimeoutException extends SignaledException {
    private final Duration timeout;

    public CommandTimeoutException(GitCommandResult result, Duration timeout) {
        super(result, describe(result) + ", timed out after " + seconds(timeout) + "s");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public Kind kind() {
        return Kind.TIMED_OUT;
    }

    private static String seconds(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? String.valueOf(millis / 1000) : String.valueOf(millis / 1000.0);
    }
}
