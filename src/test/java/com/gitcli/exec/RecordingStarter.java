package com.gitcli.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out scripted processes in order and records how each one was started.
 */
public class RecordingStarter implements GitCommandRunner.ProcessStarter {
    private final Deque<FakeProcess> processes = new ArrayDeque<>();
    private final List<List<String>> commands = new ArrayList<>();
    private Map<String, String> environmentOverrides;
    private Path workingDirectory;
    private boolean mergeStreams;

    public RecordingStarter(FakeProcess... processes) {
        this.processes.addAll(List.of(processes));
    }

    public GitCommandRunner runner() {
        return new GitCommandRunner(this, Duration.ofMillis(10), true);
    }

    @Override
    public synchronized Process start(List<String> command, Map<String, String> environmentOverrides,
            Path workingDirectory, boolean mergeStreams) throws IOException {
        commands.add(List.copyOf(command));
        this.environmentOverrides = new HashMap<>(environmentOverrides);
        this.workingDirectory = workingDirectory;
        this.mergeStreams = mergeStreams;
        FakeProcess next = processes.poll();
        if (next == null) {
            throw new IOException("No scripted process left for " + command);
        }
        return next;
    }

    public synchronized List<String> lastCommand() {
        return commands.get(commands.size() - 1);
    }

    public synchronized int invocations() {
        return commands.size();
    }

    public synchronized Map<String, String> environmentOverrides() {
        return environmentOverrides;
    }

    public synchronized Path workingDirectory() {
        return workingDirectory;
    }

    public synchronized boolean mergeStreams() {
        return mergeStreams;
    }
}
