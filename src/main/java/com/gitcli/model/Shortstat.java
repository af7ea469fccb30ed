package com.gitcli.model;

/** The one-line summary git prints for {@code --shortstat}. */
public record Shortstat(int filesChanged, int insertions, int deletions) {
    public static final Shortstat EMPTY = new Shortstat(0, 0, 0);
}
