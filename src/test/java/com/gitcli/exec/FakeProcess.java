package com.gitcli.exec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/** Scripted {@link Process} for driving {@link GitCommandRunner} without spawning anything. */
public class FakeProcess extends Process {
    private final int exitCode;
    private final boolean waitFinished;
    private final boolean interruptedWait;
    private final InputStream stdout;
    private final InputStream stderr;
    private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();

    private volatile boolean destroyCalled;
    private volatile boolean destroyForciblyCalled;

    private FakeProcess(int exitCode, boolean waitFinished, boolean interruptedWait, byte[] stdout, byte[] stderr) {
        this.exitCode = exitCode;
        this.waitFinished = waitFinished;
        this.interruptedWait = interruptedWait;
        this.stdout = new ByteArrayInputStream(stdout);
        this.stderr = new ByteArrayInputStream(stderr);
    }

    public static FakeProcess exiting(int exitCode, String stdout, String stderr) {
        return exiting(exitCode, stdout.getBytes(StandardCharsets.UTF_8), stderr.getBytes(StandardCharsets.UTF_8));
    }

    public static FakeProcess exiting(int exitCode, byte[] stdout, byte[] stderr) {
        return new FakeProcess(exitCode, true, false, stdout, stderr);
    }

    /** A process whose timed waits never finish, as if it hung. */
    public static FakeProcess hanging(String stdout, String stderr) {
        return new FakeProcess(0, false, false,
                stdout.getBytes(StandardCharsets.UTF_8), stderr.getBytes(StandardCharsets.UTF_8));
    }

    public static FakeProcess interrupting() {
        return new FakeProcess(0, true, true, new byte[0], new byte[0]);
    }

    public boolean destroyCalled() {
        return destroyCalled;
    }

    public boolean destroyForciblyCalled() {
        return destroyForciblyCalled;
    }

    public String stdinText() {
        return stdin.toString(StandardCharsets.UTF_8);
    }

    @Override
    public OutputStream getOutputStream() {
        return stdin;
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return stderr;
    }

    @Override
    public int waitFor() {
        return exitCode;
    }

    @Override
    public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
        if (interruptedWait) {
            throw new InterruptedException("interrupted");
        }
        return waitFinished;
    }

    @Override
    public int exitValue() {
        return exitCode;
    }

    @Override
    public void destroy() {
        destroyCalled = true;
    }

    @Override
    public Process destroyForcibly() {
        destroyForciblyCalled = true;
        return this;
    }

    @Override
    public boolean isAlive() {
        return !waitFinished;
    }

    @Override
    public Stream<ProcessHandle> descendants() {
        return Stream.empty();
    }
}
