package com.gitcli.exec;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/** Runs real {@code /bin/sh} processes; skipped where there is no POSIX shell. */
class GitCommandRunnerProcessTest {
    private static final Path SH = Path.of("/bin/sh");

    private final GitCommandRunner runner = new GitCommandRunner(Duration.ofMillis(500));

    @BeforeEach
    void requirePosixShell() {
        assumeTrue(Files.isExecutable(SH), "requires /bin/sh");
        assumeTrue(!System.getProperty("os.name", "").toLowerCase().startsWith("windows"), "requires POSIX signals");
    }

    @Test
    void shouldKillProcessThatOutlivesItsTimeout() {
        long started = System.nanoTime();

        CommandTimeoutException error = assertThrows(CommandTimeoutException.class,
                () -> runner.run(sh("sleep 30"), Map.of(), RunOptions.builder().timeout(Duration.ofMillis(200)).build()));

        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(10)) < 0);
        assertInstanceOf(ExitStatus.TimedOut.class, error.result().exitStatus());
        assertEquals(Duration.ofMillis(200), error.timeout());
    }

    @Test
    void shouldKillChildrenThatIgnoreTermOnceTheGracePeriodEnds() {
        long started = System.nanoTime();

        CommandTimeoutException error = assertThrows(CommandTimeoutException.class,
                () -> runner.run(sh("(trap '' TERM; sleep 8) & sleep 30"), Map.of(),
                        RunOptions.builder().timeout(Duration.ofMillis(200)).build()));

        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(3)) < 0);
        assertEquals(Duration.ofMillis(200), error.timeout());
    }

    @Test
    void shouldBoundDrainWhenBackgroundChildHoldsOutputOpen() {
        long started = System.nanoTime();

        CommandTimeoutException error = assertThrows(CommandTimeoutException.class,
                () -> runner.run(sh("sleep 8 & echo done"), Map.of(),
                        RunOptions.builder().timeout(Duration.ofMillis(300)).build()));

        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(3)) < 0);
        assertEquals(new ExitStatus.TimedOut(Duration.ofMillis(300), ExitStatus.SIGKILL), error.result().exitStatus());
        assertEquals("done", error.result().stdout());
    }

    @Test
    void shouldReportSignalDeath() {
        SignaledException error = assertThrows(SignaledException.class,
                () -> runner.run(sh("kill -9 $$"), Map.of(), RunOptions.defaults()));

        assertEquals(new ExitStatus.Signaled(ExitStatus.SIGKILL), error.result().exitStatus());
    }

    @Test
    void shouldDrainLargeOutputOnBothStreams() throws Exception {
        String script = "i=0; while [ $i -lt 20000 ]; do echo \"line $i\"; echo \"err $i\" 1>&2; i=$((i+1)); done";

        GitCommandResult result = runner.run(sh(script), Map.of(), RunOptions.defaults());

        assertEquals(20000, result.stdout().lines().count());
        assertEquals(20000, result.stderr().lines().count());
    }

    @Test
    void shouldMergeStderrIntoStdout() throws Exception {
        GitCommandResult result = runner.run(sh("echo out; echo err 1>&2"), Map.of(),
                RunOptions.builder().mergeStreams(true).build());

        assertTrue(result.stdout().contains("out"));
        assertTrue(result.stdout().contains("err"));
        assertEquals("", result.stderr());
    }

    @Test
    void shouldFeedStdin() throws Exception {
        GitCommandResult result = runner.run(sh("cat"), Map.of(),
                RunOptions.builder().stdin("piped".getBytes(StandardCharsets.UTF_8)).build());

        assertEquals("piped", result.stdout());
    }

    @Test
    void shouldSetAndUnsetEnvironmentVariables() throws Exception {
        assumeTrue(System.getenv("HOME") != null, "requires HOME in the environment");
        Map<String, String> overrides = new HashMap<>();
        overrides.put("HOME", null);
        overrides.put("GITCLI_MARKER", "set");

        GitCommandResult result = runner.run(sh("echo \"${HOME:-unset} $GITCLI_MARKER\""), overrides, RunOptions.defaults());

        assertEquals("unset set", result.stdout());
    }

    @Test
    void shouldRunInWorkingDirectory(@TempDir Path dir) throws Exception {
        GitCommandResult result = runner.run(sh("pwd"), Map.of(), RunOptions.builder().workingDirectory(dir).build());

        assertEquals(dir.toRealPath().toString(), result.stdout());
    }

    private static List<String> sh(String script) {
        return List.of(SH.toString(), "-c", script);
    }
}
