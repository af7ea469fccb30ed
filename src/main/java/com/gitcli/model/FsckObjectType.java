package com.gitcli.model;

import java.util.Locale;
import java.util.Optional;

public enum FsckObjectType {
    COMMIT,
    TREE,
    BLOB,
    TAG;

    public static Optional<FsckObjectType> fromName(String name) {
        for (FsckObjectType type : values()) {
            if (type.name().toLowerCase(Locale.ROOT).equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
