package com.gitcli.command;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import com.gitcli.exec.ExitCodePolicy;
import com.gitcli.exec.GitCommandResult;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RunOptions;
import com.gitcli.parse.OutputParser;

/**
 * Base for commands that build an argument vector, run git through a {@link GitContext} and parse
 * its stdout.
 */
abstract class GitCommand {
    protected final GitContext context;
    private final RunOptions runOptions;

    protected GitCommand(GitContext context, RunOptions runOptions) {
        this.context = Objects.requireNonNull(context, "context");
        this.runOptions = runOptions == null ? RunOptions.defaults() : runOptions;
    }

    protected <T> T execute(List<String> args, ExitCodePolicy policy, OutputParser<T> parser)
            throws IOException, InterruptedException {
        return execute(args, runOptions, policy, parser);
    }

    protected <T> T execute(List<String> args, RunOptions options, ExitCodePolicy policy, OutputParser<T> parser)
            throws IOException, InterruptedException {
        GitCommandResult result = context.run(args, options, policy);
        return parser.parse(result.stdout());
    }

    protected RunOptions runOptions() {
        return runOptions;
    }
}
