package com.gitcli.exec;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one subprocess to completion, capturing stdout and stderr concurrently so that neither
 * pipe can fill up and stall the child. Safe to share between threads; every call owns its own
 * process and buffers.
 */
public class GitCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    static final Duration DEFAULT_KILL_GRACE = Duration.ofSeconds(2);
    private static final int CHUNK_SIZE = 8192;
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private static final AtomicInteger PUMP_THREADS = new AtomicInteger();
    private static final ExecutorService PUMP_EXECUTOR = Executors.newCachedThreadPool(task -> {
        Thread thread = new Thread(task, "gitcli-pump-" + PUMP_THREADS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final ProcessStarter processStarter;
    private final Duration killGrace;
    private final boolean posixSignals;

    public GitCommandRunner() {
        this(DEFAULT_KILL_GRACE);
    }

    public GitCommandRunner(Duration killGrace) {
        this(new DefaultProcessStarter(), killGrace, !isWindows());
    }

    GitCommandRunner(ProcessStarter processStarter, Duration killGrace, boolean posixSignals) {
        this.processStarter = Objects.requireNonNull(processStarter, "processStarter");
        this.killGrace = Objects.requireNonNull(killGrace, "killGrace");
        this.posixSignals = posixSignals;
    }

    /**
     * Runs {@code command} and waits for it.
     *
     * <p>With a timeout, the whole call is bounded by the timeout plus the kill grace period. That
     * includes draining the output pipes, which background children of git can keep open after git
     * itself has exited; such leftovers are killed and reported as a timeout.
     *
     * @param environmentOverrides variables layered over the inherited environment; a {@code null}
     *                             value removes the variable
     * @return the result of a process that exited normally, whatever its exit code
     * @throws SignaledException        when the process died from a signal
     * @throws CommandTimeoutException  when the timeout elapsed and the process was killed
     * @throws ProcessIOException       when an output sink failed
     * @throws IOException              when the process could not be started
     * @throws InterruptedException     when the calling thread was interrupted; the process is killed first
     */
    public GitCommandResult run(List<String> command, Map<String, String> environmentOverrides, RunOptions options)
            throws IOException, InterruptedException {
        validate(command);
        Map<String, String> overrides = environmentOverrides == null ? Map.of() : environmentOverrides;
        Duration timeout = options.timeout();
        boolean bounded = timeout != null && !timeout.isZero();

        Process process = processStarter.start(command, overrides, options.workingDirectory(), options.mergeStreams());
        long startedAt = System.nanoTime();
        log.debug("Started {} (pid {})", command, pidOf(process));

        AtomicBoolean aborted = new AtomicBoolean();
        AtomicReference<IOException> sinkFailure = new AtomicReference<>();
        Runnable abort = () -> {
            if (aborted.compareAndSet(false, true)) {
                killTree(process, true);
            }
        };

        CompletableFuture<Void> stdinFuture = feedStdin(process, options.stdin());
        Pump stdout = pump(process.getInputStream(), options.out(), "stdout", sinkFailure, aborted, abort);
        Pump stderr = pump(process.getErrorStream(),
                options.mergeStreams() ? null : options.err(), "stderr", sinkFailure, aborted, abort);

        ExitStatus status;
        try {
            status = await(process, timeout, aborted);

            long drainDeadline = NO_DEADLINE;
            if (status instanceof ExitStatus.TimedOut || aborted.get()) {
                drainDeadline = System.nanoTime() + killGrace.toNanos();
            } else if (bounded) {
                drainDeadline = startedAt + timeout.toNanos() + killGrace.toNanos();
            }
            // evaluate both so neither pump is left unchecked
            boolean drained = stdout.finishBy(drainDeadline) & stderr.finishBy(drainDeadline);
            if (drained) {
                finishBy(stdinFuture, drainDeadline, "stdin");
            } else {
                aborted.set(true);
                log.warn("Output of {} still open {}ms after its deadline; killing leftover processes",
                        command, killGrace.toMillis());
                killTree(process, true);
                stdout.detach();
                stderr.detach();
                if (bounded && !(status instanceof ExitStatus.TimedOut)) {
                    status = new ExitStatus.TimedOut(timeout, ExitStatus.SIGKILL);
                }
            }
        } catch (InterruptedException e) {
            aborted.set(true);
            killTree(process, true);
            stdout.detach();
            stderr.detach();
            log.warn("Interrupted while waiting for {}; process killed", command);
            Thread.currentThread().interrupt();
            throw e;
        }

        GitCommandResult result = new GitCommandResult(command,
                text(stdout.captured(), options), text(stderr.captured(), options), status);

        IOException failure = sinkFailure.get();
        if (failure != null) {
            throw new ProcessIOException(
                    CommandLineException.describe(result) + ", output sink failed: " + failure.getMessage(),
                    result, failure);
        }

        log.info("{} exited with status {}", command, status);
        if (log.isDebugEnabled()) {
            log.debug("stdout:\n{}\nstderr:\n{}", result.stdout(), result.stderr());
        }

        if (status instanceof ExitStatus.TimedOut) {
            throw new CommandTimeoutException(result, timeout);
        }
        if (status instanceof ExitStatus.Signaled) {
            throw new SignaledException(result);
        }
        return result;
    }

    private ExitStatus await(Process process, Duration timeout, AtomicBoolean aborted) throws InterruptedException {
        if (timeout == null || timeout.isZero()) {
            process.waitFor();
        } else if (!process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
            aborted.set(true);
            log.warn("Process {} did not finish within {}ms; terminating", pidOf(process), timeout.toMillis());
            return new ExitStatus.TimedOut(timeout, terminate(process));
        }
        return ExitStatus.fromExitValue(process.exitValue(), posixSignals);
    }

    /**
     * Sends SIGTERM to the process tree and escalates to SIGKILL after the grace period. The tree is
     * captured before signalling because children of a dead process are reparented and no longer
     * show up as its descendants.
     *
     * @return the signal that stopped {@code process} itself
     */
    private int terminate(Process process) throws InterruptedException {
        List<ProcessHandle> tree = descendantsOf(process);
        long graceEnds = System.nanoTime() + killGrace.toNanos();
        signal(tree, false);
        process.destroy();

        boolean exited = process.waitFor(killGrace.toNanos(), TimeUnit.NANOSECONDS);
        List<ProcessHandle> survivors = survivors(tree, graceEnds);
        if (!survivors.isEmpty()) {
            log.warn("{} child process(es) of {} ignored SIGTERM for {}ms; sending SIGKILL",
                    survivors.size(), pidOf(process), killGrace.toMillis());
            signal(survivors, true);
        }
        if (exited) {
            return ExitStatus.SIGTERM;
        }
        log.warn("Process {} ignored SIGTERM for {}ms; sending SIGKILL", pidOf(process), killGrace.toMillis());
        killTree(process, true);
        process.waitFor();
        return ExitStatus.SIGKILL;
    }

    private static List<ProcessHandle> survivors(List<ProcessHandle> handles, long graceEnds) throws InterruptedException {
        List<ProcessHandle> alive = new ArrayList<>();
        for (ProcessHandle handle : handles) {
            long remaining = graceEnds - System.nanoTime();
            if (remaining > 0 && handle.isAlive()) {
                try {
                    handle.onExit().get(remaining, TimeUnit.NANOSECONDS);
                } catch (TimeoutException | ExecutionException e) {
                    log.debug("Process {} still running at the end of the grace period", handle.pid());
                }
            }
            if (handle.isAlive()) {
                alive.add(handle);
            }
        }
        return alive;
    }

    private static void killTree(Process process, boolean forcibly) {
        signal(descendantsOf(process), forcibly);
        if (forcibly) {
            process.destroyForcibly();
        } else {
            process.destroy();
        }
    }

    private static void signal(List<ProcessHandle> handles, boolean forcibly) {
        for (ProcessHandle handle : handles) {
            if (forcibly) {
                handle.destroyForcibly();
            } else {
                handle.destroy();
            }
        }
    }

    private static List<ProcessHandle> descendantsOf(Process process) {
        try {
            return process.descendants().toList();
        } catch (UnsupportedOperationException e) {
            return List.of();
        }
    }

    private static String pidOf(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "?";
        }
    }

    private static CompletableFuture<Void> feedStdin(Process process, byte[] stdin) {
        OutputStream processIn = process.getOutputStream();
        if (stdin == null) {
            closeQuietly(processIn);
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try (OutputStream in = processIn) {
                in.write(stdin);
            } catch (IOException e) {
                // git may exit before consuming all of its input
                log.debug("stdin closed early: {}", e.getMessage());
            }
        }, PUMP_EXECUTOR);
    }

    private static void closeQuietly(Closeable stream) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Failed to close process stream: {}", e.getMessage());
        }
    }

    private static Pump pump(InputStream stream,
            OutputStream sink,
            String name,
            AtomicReference<IOException> sinkFailure,
            AtomicBoolean aborted,
            Runnable abort) {
        Pump pump = new Pump(name, stream);
        pump.done = CompletableFuture.runAsync(() -> {
            byte[] buffer = new byte[CHUNK_SIZE];
            try (InputStream in = stream) {
                int read;
                while ((read = in.read(buffer)) != -1 && !pump.detached) {
                    pump.captured.write(buffer, 0, read);
                    if (sink != null && !writeToSink(sink, buffer, read, name, sinkFailure)) {
                        abort.run();
                        break;
                    }
                }
            } catch (IOException e) {
                if (!aborted.get()) {
                    throw new UncheckedIOException("Failed reading " + name, e);
                }
                log.debug("{} closed after the process was killed: {}", name, e.getMessage());
            }
        }, PUMP_EXECUTOR);
        return pump;
    }

    private static boolean writeToSink(OutputStream sink, byte[] buffer, int length, String name,
            AtomicReference<IOException> sinkFailure) {
        try {
            sink.write(buffer, 0, length);
            return true;
        } catch (IOException e) {
            log.warn("{} sink failed: {}", name, e.getMessage());
            sinkFailure.compareAndSet(null, e);
            return false;
        }
    }

    /**
     * Waits for {@code future} until {@code deadline} (a {@link System#nanoTime()} value, or
     * {@link #NO_DEADLINE}).
     *
     * @return {@code false} when the deadline passed first
     */
    private static boolean finishBy(CompletableFuture<?> future, long deadline, String name)
            throws IOException, InterruptedException {
        try {
            if (deadline == NO_DEADLINE) {
                future.get();
            } else {
                future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            }
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            throw new IOException("Failed handling " + name, e.getCause());
        }
    }

    /** One output pipe being drained into memory and, optionally, a caller's sink. */
    private static final class Pump {
        private final String name;
        private final InputStream stream;
        private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        private volatile boolean detached;
        private CompletableFuture<Void> done;

        private Pump(String name, InputStream stream) {
            this.name = name;
            this.stream = stream;
        }

        boolean finishBy(long deadline) throws IOException, InterruptedException {
            return GitCommandRunner.finishBy(done, deadline, name);
        }

        /** Stops delivering output; a reader blocked on a pipe held by a leftover child just exits later. */
        void detach() {
            detached = true;
            closeQuietly(stream);
        }

        byte[] captured() {
            return captured.toByteArray();
        }
    }

    static String text(byte[] bytes, RunOptions options) {
        String decoded = options.normalize()
                ? decode(bytes, options)
                : new String(bytes, StandardCharsets.ISO_8859_1);
        return options.chomp() ? chomp(decoded) : decoded;
    }

    private static String decode(byte[] bytes, RunOptions options) {
        try {
            return options.encoding().newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            // unreachable with REPLACE, kept for the checked signature
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /** Removes exactly one trailing {@code \n}, {@code \r\n} or {@code \r}. */
    static String chomp(String text) {
        if (text.endsWith("\r\n")) {
            return text.substring(0, text.length() - 2);
        }
        if (text.endsWith("\n") || text.endsWith("\r")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }

    private static void validate(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        for (String argument : command) {
            if (argument == null) {
                throw new IllegalArgumentException("command contains a null argument: " + command);
            }
        }
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows");
    }

    interface ProcessStarter {
        Process start(List<String> command, Map<String, String> environmentOverrides, Path workingDirectory,
                boolean mergeStreams) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(List<String> command, Map<String, String> environmentOverrides, Path workingDirectory,
                boolean mergeStreams) throws IOException {
            ProcessBuilder builder = new ProcessBuilder(new ArrayList<>(command))
                    .directory(workingDirectory == null ? null : workingDirectory.toFile())
                    .redirectErrorStream(mergeStreams);
            Map<String, String> environment = builder.environment();
            environmentOverrides.forEach((key, value) -> {
                if (value == null) {
                    environment.remove(key);
                } else {
                    environment.put(key, value);
                }
            });
            return builder.start();
        }
    }

    @Override
    public String toString() {
        return "GitCommandRunner{" +
                "killGrace=" + killGrace +
                ", processStarter=" + processStarter.getClass().getSimpleName() +
                '}';
    }
}
