package com.gitcli.command;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.gitcli.Fixtures;
import com.gitcli.exec.ExitCodePolicy;
import com.gitcli.exec.FailedException;
import com.gitcli.exec.FakeProcess;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.RecordingStarter;
import com.gitcli.model.DiffResult;
import com.gitcli.model.NumstatResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiffCommandsTest {

    @Test
    void shouldBuildRawDiffArguments() {
        DiffOptions options = DiffOptions.builder()
                .commit1("HEAD~1")
                .commit2("HEAD")
                .findRenames("50%")
                .pathspecs(List.of("lib", "docs"))
                .build();

        assertEquals(List.of("diff", "--raw", "--numstat", "--shortstat", "--src-prefix=a/", "--dst-prefix=b/",
                "--find-renames=50%", "HEAD~1", "HEAD", "--", "lib", "docs"), DiffRawCommand.arguments(options));
    }

    @Test
    void shouldBuildNumstatAndPatchArguments() {
        DiffOptions options = DiffOptions.builder().cached(true).dirstat("").build();

        assertEquals(List.of("diff", "--numstat", "--shortstat", "-M", "--cached", "--dirstat"),
                DiffNumstatCommand.arguments(options));
        assertEquals(List.of("diff", "--patch", "--numstat", "--shortstat", "--src-prefix=a/", "--dst-prefix=b/", "-M",
                "--cached", "--dirstat"), DiffPatchCommand.arguments(options));
    }

    @Test
    void shouldRejectRevisionsThatLookLikeOptions() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> DiffOptions.builder().commit1("--output=/tmp/x").build());

        assertEquals("Invalid commit or commit range: '--output=/tmp/x'", error.getMessage());
        assertThrows(IllegalArgumentException.class, () -> DiffOptions.builder().commit2("HEAD").build());
        assertThrows(IllegalArgumentException.class, () -> DiffOptions.builder().cached(true).noIndex(true).build());
    }

    @Test
    void shouldAcceptDifferencesExitCodeAndParseOutput() throws Exception {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(1, Fixtures.read("diff_raw.txt"), ""));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        DiffResult result = new DiffRawCommand(context).call(DiffOptions.defaults());

        assertEquals(6, result.entries().size());
        List<String> command = starter.lastCommand();
        assertEquals("git", command.get(0));
        assertTrue(command.containsAll(List.of("core.quotePath=true", "diff", "--raw")));
    }

    @Test
    void shouldFailOnExitCodeAboveOne() {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(128, "", "fatal: bad revision 'nope'"));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        FailedException error = assertThrows(FailedException.class,
                () -> new DiffRawCommand(context).call(DiffOptions.builder().commit1("nope").build()));

        assertEquals("fatal: bad revision 'nope'", error.result().stderr());
    }

    @Test
    void shouldFailOnExitCodeTwo() {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(2, "", "error: invalid option"));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        FailedException error = assertThrows(FailedException.class,
                () -> new DiffNumstatCommand(context).call(DiffOptions.defaults()));

        assertEquals(2, error.result().exitCode());
    }

    @Test
    void shouldTreatExitCodeOneAsDifferencesFound() throws Exception {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(1, Fixtures.read("diff_numstat.txt"), ""));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        NumstatResult result = new DiffNumstatCommand(context).call(DiffOptions.defaults());

        assertFalse(result.entries().isEmpty());
    }

    @Test
    void shouldDrawDiffPolicyBoundaryBetweenOneAndTwo() {
        assertTrue(ExitCodePolicy.DIFF.accepts(0));
        assertTrue(ExitCodePolicy.DIFF.accepts(1));
        assertFalse(ExitCodePolicy.DIFF.accepts(2));
        assertFalse(ExitCodePolicy.DIFF.accepts(128));
    }

    @Test
    void shouldParseNumstatListing() throws Exception {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(0, Fixtures.read("diff_numstat.txt"), ""));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        NumstatResult result = new DiffNumstatCommand(context).call(DiffOptions.defaults());

        assertEquals(5, result.filesChanged());
        assertEquals(10, result.totalInsertions());
    }

    @Test
    void shouldParsePatchListing() throws Exception {
        RecordingStarter starter = new RecordingStarter(FakeProcess.exiting(1, Fixtures.read("diff_patch.txt"), ""));
        GitContext context = GitContext.builder().runner(starter.runner()).build();

        DiffResult result = new DiffPatchCommand(context).call(DiffOptions.defaults());

        assertEquals(6, result.entries().size());
        assertTrue(result.entries().get(0).patch().contains("+added one"));
    }
}
