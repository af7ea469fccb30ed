package com.gitcli.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Process-wide defaults for git invocations. Every invocation reads one {@link Snapshot} when it
 * starts, so a concurrent {@link #set(Snapshot)} never affects a run that is already underway.
 */
public final class GitDefaults {
    public static final String DEFAULT_BINARY = "git";

    /**
     * @param binaryPath git executable, resolved through {@code PATH} when not absolute
     * @param timeout    default deadline, {@code null} or zero for none
     * @param sshCommand value exported as {@code GIT_SSH}, or {@code null} to unset it
     */
    public record Snapshot(String binaryPath, Duration timeout, String sshCommand) {
        public Snapshot {
            if (binaryPath == null || binaryPath.isBlank()) {
                throw new IllegalArgumentException("binaryPath must not be blank");
            }
            if (timeout != null && timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must not be negative: " + timeout);
            }
        }
    }

    private static final Snapshot INITIAL = new Snapshot(DEFAULT_BINARY, null, null);

    private static volatile Snapshot current = INITIAL;

    private GitDefaults() {
    }

    public static Snapshot snapshot() {
        return current;
    }

    public static void set(Snapshot snapshot) {
        current = Objects.requireNonNull(snapshot, "snapshot");
    }

    public static void reset() {
        current = INITIAL;
    }
}
