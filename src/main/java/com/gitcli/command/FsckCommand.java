package com.gitcli.command;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.gitcli.exec.ExitCodePolicy;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RunOptions;
import com.gitcli.model.FsckResult;
import com.gitcli.parse.FsckParser;

/**
 * Repository integrity check. git prints warnings on stderr, so both streams are merged before
 * parsing. Exit codes 0 to 7 are fsck's bitmask of error classes and count as a completed check.
 */
public class FsckCommand extends GitCommand {

    public FsckCommand(GitContext context) {
        this(context, null);
    }

    public FsckCommand(GitContext context, RunOptions runOptions) {
        super(context, runOptions);
    }

    public FsckResult call(FsckOptions options) throws IOException, InterruptedException {
        RunOptions merged = runOptions().toBuilder().mergeStreams(true).build();
        return execute(arguments(options), merged, ExitCodePolicy.FSCK, new FsckParser());
    }

    static List<String> arguments(FsckOptions options) {
        List<String> args = new ArrayList<>(List.of("fsck", "--no-progress"));
        options.appendTo(args);
        return args;
    }
}
