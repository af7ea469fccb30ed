package com.gitcli.command;

import java.io.IOException;

import com.gitcli.exec.GitContext;
import com.gitcli.exec.GitVersion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reports the git binary's version, probing it once per binary path. */
public class VersionCommand {
    private static final Logger log = LoggerFactory.getLogger(VersionCommand.class);

    private final GitContext context;

    public VersionCommand(GitContext context) {
        this.context = context;
    }

    public GitVersion call() throws IOException, InterruptedException {
        GitVersion version = GitVersion.detect(context);
        if (!version.meetsMinimum()) {
            log.warn("git {} is older than the minimum supported {}", version, GitVersion.MINIMUM_SUPPORTED);
        }
        return version;
    }
}
