package com.gitcli.model;

import java.util.Objects;

/**
 * An object named in an fsck report.
 *
 * @param type    the object type
 * @param sha     the 40-hex object id
 * @param name    the ref/path annotation ({@code --name-objects}) or the tag name for tagged objects
 * @param message the warning text for warning entries
 */
public record FsckObject(FsckObjectType type, String sha, String name, String message) {
    public FsckObject {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sha, "sha");
    }

    public FsckObject(FsckObjectType type, String sha) {
        this(type, sha, null, null);
    }
}
