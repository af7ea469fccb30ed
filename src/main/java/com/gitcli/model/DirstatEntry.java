package com.gitcli.model;

public record DirstatEntry(String directory, double percent) {
}
