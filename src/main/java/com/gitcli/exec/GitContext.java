package com.gitcli.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repository location and environment for running git. Immutable; the {@code with*} methods
 * return modified copies so one context can be shared across threads.
 */
public final class GitContext {
    private static final Logger log = LoggerFactory.getLogger(GitContext.class);

    public static final String DEFAULT_LOCALE = "en_US.UTF-8";

    /** Options that keep git output stable for parsing: quoted paths and no color. */
    static final List<String> STATIC_GLOBAL_OPTIONS = List.of(
            "-c", "core.quotePath=true",
            "-c", "color.ui=false",
            "-c", "color.advice=false",
            "-c", "color.diff=false",
            "-c", "color.grep=false",
            "-c", "color.push=false",
            "-c", "color.remote=false",
            "-c", "color.showBranch=false",
            "-c", "color.status=false",
            "-c", "color.transport=false");

    private final Path gitDir;
    private final Path workTree;
    private final Path indexFile;
    private final String binaryPath;
    private final String sshCommand;
    private final String locale;
    private final GitCommandRunner runner;

    private GitContext(Builder builder) {
        this.gitDir = builder.gitDir;
        this.workTree = builder.workTree;
        this.indexFile = builder.indexFile;
        this.binaryPath = builder.binaryPath;
        this.sshCommand = builder.sshCommand;
        this.locale = builder.locale;
        this.runner = builder.runner == null ? new GitCommandRunner() : builder.runner;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A context for the repository whose working tree is {@code workTree}. */
    public static GitContext forWorkTree(Path workTree) {
        return builder().workTree(workTree).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .gitDir(gitDir)
                .workTree(workTree)
                .indexFile(indexFile)
                .binaryPath(binaryPath)
                .sshCommand(sshCommand)
                .locale(locale)
                .runner(runner);
    }

    public GitContext withIndexFile(Path newIndexFile) {
        return toBuilder().indexFile(newIndexFile).build();
    }

    public GitContext withWorkTree(Path newWorkTree) {
        return toBuilder().workTree(newWorkTree).build();
    }

    public Path gitDir() {
        return gitDir;
    }

    public Path workTree() {
        return workTree;
    }

    public Path indexFile() {
        return indexFile;
    }

    /** The binary this context runs: its own override, else the process-wide default. */
    public String resolveBinary() {
        return resolveBinary(GitDefaults.snapshot());
    }

    /**
     * Runs {@code git <global options> <args>} and checks the exit code against {@code policy}.
     *
     * @throws FailedException when git exited with a code outside {@code policy}
     */
    public GitCommandResult run(List<String> args, RunOptions options, ExitCodePolicy policy)
            throws IOException, InterruptedException {
        GitDefaults.Snapshot defaults = GitDefaults.snapshot();
        RunOptions effective = options;
        if (effective.timeout() == null && defaults.timeout() != null) {
            effective = effective.withTimeout(defaults.timeout());
        }
        if (effective.workingDirectory() == null && workTree != null) {
            effective = effective.withWorkingDirectory(workTree);
        }

        GitCommandResult result = runner.run(commandLine(defaults, args), environmentOverrides(defaults), effective);
        try {
            return policy.check(result);
        } catch (FailedException e) {
            log.warn("git command rejected subcommand={} exitCode={} allowed={} stderr={}",
                    args.isEmpty() ? "" : args.get(0), result.exitCode(), policy, result.stderr());
            throw e;
        }
    }

    List<String> commandLine(GitDefaults.Snapshot defaults, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(resolveBinary(defaults));
        command.addAll(STATIC_GLOBAL_OPTIONS);
        if (gitDir != null) {
            command.add("--git-dir=" + gitDir);
        }
        if (workTree != null) {
            command.add("--work-tree=" + workTree);
        }
        command.addAll(args);
        return command;
    }

    /**
     * Variables layered over the inherited environment. Entries with a {@code null} value are
     * removed, so an inherited {@code GIT_DIR} cannot redirect a context that did not set one.
     */
    Map<String, String> environmentOverrides(GitDefaults.Snapshot defaults) {
        Map<String, String> overrides = new LinkedHashMap<>();
        overrides.put("GIT_DIR", pathOrNull(gitDir));
        overrides.put("GIT_WORK_TREE", pathOrNull(workTree));
        overrides.put("GIT_INDEX_FILE", pathOrNull(indexFile));
        overrides.put("GIT_SSH", sshCommand != null ? sshCommand : defaults.sshCommand());
        overrides.put("LC_ALL", locale);
        return Collections.unmodifiableMap(overrides);
    }

    private String resolveBinary(GitDefaults.Snapshot defaults) {
        return binaryPath != null ? binaryPath : defaults.binaryPath();
    }

    private static String pathOrNull(Path path) {
        return path == null ? null : path.toString();
    }

    @Override
    public String toString() {
        return "GitContext{" +
                "gitDir=" + gitDir +
                ", workTree=" + workTree +
                ", indexFile=" + indexFile +
                '}';
    }

    public static final class Builder {
        private Path gitDir;
        private Path workTree;
        private Path indexFile;
        private String binaryPath;
        private String sshCommand;
        private String locale = DEFAULT_LOCALE;
        private GitCommandRunner runner;

        private Builder() {
        }

        public Builder gitDir(Path gitDir) {
            this.gitDir = gitDir;
            return this;
        }

        public Builder workTree(Path workTree) {
            this.workTree = workTree;
            return this;
        }

        public Builder indexFile(Path indexFile) {
            this.indexFile = indexFile;
            return this;
        }

        public Builder binaryPath(String binaryPath) {
            this.binaryPath = binaryPath;
            return this;
        }

        public Builder sshCommand(String sshCommand) {
            this.sshCommand = sshCommand;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder runner(GitCommandRunner runner) {
            this.runner = runner;
            return this;
        }

        public GitContext build() {
            return new GitContext(this);
        }
    }
}
