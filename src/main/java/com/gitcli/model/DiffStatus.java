package com.gitcli.model;

import java.util.Optional;

public enum DiffStatus {
    MODIFIED('M'),
    ADDED('A'),
    DELETED('D'),
    RENAMED('R'),
    COPIED('C'),
    TYPE_CHANGED('T'),
    UNMERGED('U');

    private final char letter;

    DiffStatus(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    public boolean carriesSimilarity() {
        return this == RENAMED || this == COPIED;
    }

    public static Optional<DiffStatus> fromLetter(char letter) {
        for (DiffStatus status : values()) {
            if (status.letter == letter) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
