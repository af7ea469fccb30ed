package com.gitcli.exec;

import java.time.Duration;
import java.util.Map;

/**
 * How a git subprocess ended. One of {@link Exited}, {@link Signaled} or {@link TimedOut}.
 */
public interface ExitStatus {
    int SIGHUP = 1;
    int SIGKILL = 9;
    int SIGTERM = 15;

    /** Highest signal number decoded from a {@code 128 + n} exit value. */
    int MAX_SIGNAL = 64;

    Map<Integer, String> SIGNAL_NAMES = Map.of(
            1, "SIGHUP",
            2, "SIGINT",
            3, "SIGQUIT",
            6, "SIGABRT",
            9, "SIGKILL",
            13, "SIGPIPE",
            15, "SIGTERM");

    /** Whether the process exited normally with code 0. */
    boolean success();

    record Exited(int code) implements ExitStatus {
        @Override
        public boolean success() {
            return code == 0;
        }

        @Override
        public String toString() {
            return "exit " + code;
        }
    }

    record Signaled(int signal) implements ExitStatus {
        @Override
        public boolean success() {
            return false;
        }

        @Override
        public String toString() {
            return "killed by " + signalName(signal);
        }
    }

    /**
     * @param after  the configured deadline
     * @param signal the signal that finally stopped the process
     */
    record TimedOut(Duration after, int signal) implements ExitStatus {
        @Override
        public boolean success() {
            return false;
        }

        @Override
        public String toString() {
            return "timed out after " + after.toMillis() + "ms, killed by " + signalName(signal);
        }
    }

    /**
     * Classifies a {@link Process#exitValue()}. The JDK reports death by signal {@code n} as
     * {@code 128 + n} on POSIX systems. 129 stays a normal exit because git uses it for usage
     * errors, so a SIGHUP is reported as {@code exit 129}.
     */
    static ExitStatus fromExitValue(int exitValue, boolean posixSignals) {
        int signal = exitValue - 128;
        if (posixSignals && signal > SIGHUP && signal <= MAX_SIGNAL) {
            return new Signaled(signal);
        }
        return new Exited(exitValue);
    }

    static String signalName(int signal) {
        return SIGNAL_NAMES.getOrDefault(signal, "signal " + signal);
    }
}
