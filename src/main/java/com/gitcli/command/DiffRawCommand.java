package com.gitcli.command;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.gitcli.exec.ExitCodePolicy;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RunOptions;
import com.gitcli.model.DiffResult;
import com.gitcli.parse.RawDiffParser;

/**
 * Lists changed files with modes, object ids and line counts using
 * {@code git diff --raw --numstat --shortstat}.
 */
public class DiffRawCommand extends GitCommand {

    public DiffRawCommand(GitContext context) {
        this(context, null);
    }

    public DiffRawCommand(GitContext context, RunOptions runOptions) {
        super(context, runOptions);
    }

    public DiffResult call(DiffOptions options) throws IOException, InterruptedException {
        return execute(arguments(options), ExitCodePolicy.DIFF, new RawDiffParser(options.dirstat() != null));
    }

    static List<String> arguments(DiffOptions options) {
        List<String> args = new ArrayList<>(List.of(
                "diff", "--raw", "--numstat", "--shortstat", "--src-prefix=a/", "--dst-prefix=b/"));
        options.appendTo(args);
        return args;
    }
}
