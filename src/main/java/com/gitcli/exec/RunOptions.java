package com.gitcli.exec;

import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;

/**
 * Per-invocation knobs for {@link GitCommandRunner}.
 *
 * @param stdin            bytes written to the child's stdin, or {@code null} to close it immediately;
 *                         copied on the way in and out
 * @param out              sink that receives stdout as it is produced, in addition to the capture
 * @param err              sink that receives stderr as it is produced
 * @param mergeStreams     interleave stderr into stdout
 * @param timeout          deadline; {@code null} falls back to {@link GitDefaults}, zero disables it
 * @param chomp            strip one trailing line terminator from captured text
 * @param normalize        decode output with {@code encoding}; otherwise decode byte for byte as ISO-8859-1
 * @param encoding         charset git writes its output in
 * @param workingDirectory directory to start git in, or {@code null} for the current one
 */
public record RunOptions(
        byte[] stdin,
        OutputStream out,
        OutputStream err,
        boolean mergeStreams,
        Duration timeout,
        boolean chomp,
        boolean normalize,
        Charset encoding,
        Path workingDirectory) {

    public RunOptions {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        encoding = encoding == null ? StandardCharsets.UTF_8 : encoding;
        stdin = stdin == null ? null : stdin.clone();
    }

    @Override
    public byte[] stdin() {
        return stdin == null ? null : stdin.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunOptions other)) {
            return false;
        }
        return mergeStreams == other.mergeStreams
                && chomp == other.chomp
                && normalize == other.normalize
                && Arrays.equals(stdin, other.stdin)
                && Objects.equals(out, other.out)
                && Objects.equals(err, other.err)
                && Objects.equals(timeout, other.timeout)
                && encoding.equals(other.encoding)
                && Objects.equals(workingDirectory, other.workingDirectory);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(out, err, mergeStreams, timeout, chomp, normalize, encoding, workingDirectory)
                + Arrays.hashCode(stdin);
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .stdin(stdin)
                .out(out)
                .err(err)
                .mergeStreams(mergeStreams)
                .timeout(timeout)
                .chomp(chomp)
                .normalize(normalize)
                .encoding(encoding)
                .workingDirectory(workingDirectory);
    }

    public RunOptions withTimeout(Duration newTimeout) {
        return toBuilder().timeout(newTimeout).build();
    }

    public RunOptions withWorkingDirectory(Path directory) {
        return toBuilder().workingDirectory(directory).build();
    }

    public static final class Builder {
        private byte[] stdin;
        private OutputStream out;
        private OutputStream err;
        private boolean mergeStreams;
        private Duration timeout;
        private boolean chomp = true;
        private boolean normalize = true;
        private Charset encoding = StandardCharsets.UTF_8;
        private Path workingDirectory;

        private Builder() {
        }

        public Builder stdin(byte[] stdin) {
            this.stdin = stdin;
            return this;
        }

        public Builder out(OutputStream out) {
            this.out = out;
            return this;
        }

        public Builder err(OutputStream err) {
            this.err = err;
            return this;
        }

        public Builder mergeStreams(boolean mergeStreams) {
            this.mergeStreams = mergeStreams;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder chomp(boolean chomp) {
            this.chomp = chomp;
            return this;
        }

        public Builder normalize(boolean normalize) {
            this.normalize = normalize;
            return this;
        }

        public Builder encoding(Charset encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(stdin, out, err, mergeStreams, timeout, chomp, normalize, encoding, workingDirectory);
        }
    }
}
