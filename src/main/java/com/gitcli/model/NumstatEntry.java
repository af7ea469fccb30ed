package com.gitcli.model;

/**
 * One {@code --numstat} line. Binary files are reported by git as {@code -} counts and read as 0.
 */
public record NumstatEntry(String path, String srcPath, int insertions, int deletions, boolean binary) {
    public boolean isRenamed() {
        return srcPath != null;
    }
}
