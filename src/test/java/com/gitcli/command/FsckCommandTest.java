package com.gitcli.command;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.gitcli.Fixtures;
import com.gitcli.exec.FailedException;
import com.gitcli.exec.FakeProcess;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RecordingStarter;
import com.gitcli.model.FsckResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FsckCommandTest {
    private static final String SHA = "1234567890".repeat(4);

    @Test
    void shouldBuildArgumentsFromFlags() {
        FsckOptions options = FsckOptions.builder()
                .unreachable(true)
                .root(true)
                .full(false)
                .nameObjects(true)
                .objects(List.of(SHA))
                .build();

        assertEquals(List.of("fsck", "--no-progress", "--unreachable", "--root", "--no-full", "--name-objects", SHA),
                FsckCommand.arguments(options));
    }

    @Test
    void shouldRejectObjectsThatLookLikeOptions() {
        assertThrows(IllegalArgumentException.class, () -> FsckOptions.builder().objects(List.of("--lost-found")).build());
    }

    @Test
    void shouldMergeStreamsAndAcceptErrorBitmask() throws Exception {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(3, Fixtures.read("fsck.txt"), ""));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        FsckResult result = new FsckCommand(context).call(FsckOptions.defaults());

        assertTrue(starter.mergeStreams());
        assertEquals(2, result.dangling().size());
        assertEquals(1, result.warnings().size());
    }

    @Test
    void shouldFailBeyondFsckExitCodes() {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(128, "fatal: not a git repository", ""));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        assertThrows(FailedException.class, () -> new FsckCommand(context).call(FsckOptions.defaults()));
    }
}
