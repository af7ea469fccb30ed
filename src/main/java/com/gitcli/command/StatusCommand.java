package com.gitcli.command;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.gitcli.exec.ExitCodePolicy;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RunOptions;
import com.gitcli.model.StatusEntry;
import com.gitcli.model.StatusReport;
import com.gitcli.parse.IndexParser;
import com.gitcli.parse.StatusParser;

/**
 * Working tree status: every indexed path from {@code git ls-files --stage}, overlaid with the
 * changes reported by {@code git status --porcelain=v2}.
 */
public class StatusCommand extends GitCommand {

    public StatusCommand(GitContext context) {
        this(context, null);
    }

    public StatusCommand(GitContext context, RunOptions runOptions) {
        super(context, runOptions);
    }

    public StatusReport call(StatusOptions options) throws IOException, InterruptedException {
        List<StatusEntry> index = execute(indexArguments(options), ExitCodePolicy.ZERO_ONLY, new IndexParser());
        StatusReport changes = execute(arguments(options), ExitCodePolicy.ZERO_ONLY, new StatusParser());
        return changes.withIndex(index);
    }

    static List<String> indexArguments(StatusOptions options) {
        List<String> args = new ArrayList<>(List.of("ls-files", "--stage"));
        GitArguments.appendPathspecs(args, options.pathspecs());
        return args;
    }

    static List<String> arguments(StatusOptions options) {
        List<String> args = new ArrayList<>(List.of(
                "status", "--porcelain=v2", "--branch", "--untracked-files=" + options.untrackedFiles()));
        if (options.ignored()) {
            args.add("--ignored=matching");
        }
        GitArguments.appendPathspecs(args, options.pathspecs());
        return args;
    }
}
