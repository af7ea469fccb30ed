package com.gitcli.exec;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version of a git binary, as reported by {@code git version}.
 */
public record GitVersion(int major, int minor, int patch) implements Comparable<GitVersion> {
    public static final GitVersion MINIMUM_SUPPORTED = new GitVersion(2, 28, 0);

    private static final Pattern VERSION = Pattern.compile("(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?");
    private static final ConcurrentMap<String, GitVersion> CACHE = new ConcurrentHashMap<>();

    public GitVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must not be negative");
        }
    }

    /**
     * Parses output such as {@code git version 2.39.2} or {@code git version 2.39.2.windows.1}.
     * Missing components are zero.
     */
    public static GitVersion parse(String output) {
        String text = output == null ? "" : output.trim();
        if (text.startsWith("git version")) {
            text = text.substring("git version".length()).trim();
        }
        Matcher matcher = VERSION.matcher(text);
        if (!matcher.lookingAt()) {
            throw new IllegalArgumentException("Unrecognized git version output: '" + output + "'");
        }
        return new GitVersion(
                Integer.parseInt(matcher.group(1)),
                component(matcher.group(2)),
                component(matcher.group(3)));
    }

    /** Runs {@code git version} once per binary path and caches the answer. */
    public static GitVersion detect(GitContext context) throws IOException, InterruptedException {
        String binary = context.resolveBinary();
        GitVersion cached = CACHE.get(binary);
        if (cached != null) {
            return cached;
        }
        GitCommandResult result = context.run(List.of("version"), RunOptions.defaults(), ExitCodePolicy.ZERO_ONLY);
        GitVersion version = parse(result.stdout());
        GitVersion previous = CACHE.putIfAbsent(binary, version);
        return previous != null ? previous : version;
    }

    static void clearCache() {
        CACHE.clear();
    }

    public boolean meetsMinimum() {
        return compareTo(MINIMUM_SUPPORTED) >= 0;
    }

    @Override
    public int compareTo(GitVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    private static int component(String value) {
        return value == null ? 0 : Integer.parseInt(value);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
