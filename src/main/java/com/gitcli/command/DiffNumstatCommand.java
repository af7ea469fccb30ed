package com.gitcli.command;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.gitcli.exec.ExitCodePolicy;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RunOptions;
import com.gitcli.model.NumstatResult;
import com.gitcli.parse.NumstatParser;

/** Per-file line counts from {@code git diff --numstat --shortstat -M}. */
public class DiffNumstatCommand extends GitCommand {

    public DiffNumstatCommand(GitContext context) {
        this(context, null);
    }

    public DiffNumstatCommand(GitContext context, RunOptions runOptions) {
        super(context, runOptions);
    }

    public NumstatResult call(DiffOptions options) throws IOException, InterruptedException {
        return execute(arguments(options), ExitCodePolicy.DIFF, new NumstatParser(options.dirstat() != null));
    }

    static List<String> arguments(DiffOptions options) {
        List<String> args = new ArrayList<>(List.of("diff", "--numstat", "--shortstat", "-M"));
        options.appendTo(args);
        return args;
    }
}
