package com.gitcli.command;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.gitcli.exec.ExitCodePolicy;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RunOptions;
import com.gitcli.model.DiffResult;
import com.gitcli.parse.PatchDiffParser;

/** Changed files together with their patch text, from {@code git diff --patch}. */
public class DiffPatchCommand extends GitCommand {

    public DiffPatchCommand(GitContext context) {
        this(context, null);
    }

    public DiffPatchCommand(GitContext context, RunOptions runOptions) {
        super(context, runOptions);
    }

    public DiffResult call(DiffOptions options) throws IOException, InterruptedException {
        return execute(arguments(options), ExitCodePolicy.DIFF, new PatchDiffParser(options.dirstat() != null));
    }

    static List<String> arguments(DiffOptions options) {
        List<String> args = new ArrayList<>(List.of(
                "diff", "--patch", "--numstat", "--shortstat", "--src-prefix=a/", "--dst-prefix=b/", "-M"));
        options.appendTo(args);
        return args;
    }
}
