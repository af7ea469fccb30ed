package com.gitcli.runtime;

import java.nio.charset.Charset;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.GitDefaults;
import com.gitcli.exec.RunOptions;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private GitConfig git = new GitConfig();

    public GitConfig getGit() {
        return git;
    }

    public void setGit(GitConfig git) {
        this.git = git == null ? new GitConfig() : git;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitConfig {
        private String binaryPath = GitDefaults.DEFAULT_BINARY;
        private long timeoutMs = 0;
        private long killGraceMs = 2000;
        private String sshCommand;
        private String locale = GitContext.DEFAULT_LOCALE;
        private String outputEncoding = "UTF-8";
        private boolean normalizeOutput = true;
        private boolean chompOutput = true;

        public String getBinaryPath() {
            return binaryPath;
        }

        public void setBinaryPath(String binaryPath) {
            this.binaryPath = binaryPath;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getKillGraceMs() {
            return killGraceMs;
        }

        public void setKillGraceMs(long killGraceMs) {
            this.killGraceMs = killGraceMs;
        }

        public String getSshCommand() {
            return sshCommand;
        }

        public void setSshCommand(String sshCommand) {
            this.sshCommand = sshCommand;
        }

        public String getLocale() {
            return locale;
        }

        public void setLocale(String locale) {
            this.locale = locale;
        }

        public String getOutputEncoding() {
            return outputEncoding;
        }

        public void setOutputEncoding(String outputEncoding) {
            this.outputEncoding = outputEncoding;
        }

        public boolean isNormalizeOutput() {
            return normalizeOutput;
        }

        public void setNormalizeOutput(boolean normalizeOutput) {
            this.normalizeOutput = normalizeOutput;
        }

        public boolean isChompOutput() {
            return chompOutput;
        }

        public void setChompOutput(boolean chompOutput) {
            this.chompOutput = chompOutput;
        }

        /** Process-wide defaults described by this section. A zero timeout means none. */
        public GitDefaults.Snapshot toDefaults() {
            if (timeoutMs < 0) {
                throw new IllegalArgumentException("git.timeoutMs must not be negative: " + timeoutMs);
            }
            return new GitDefaults.Snapshot(
                    binaryPath,
                    timeoutMs == 0 ? null : Duration.ofMillis(timeoutMs),
                    sshCommand);
        }

        public RunOptions toRunOptions() {
            return RunOptions.builder()
                    .encoding(Charset.forName(outputEncoding))
                    .normalize(normalizeOutput)
                    .chomp(chompOutput)
                    .build();
        }

        public Duration killGrace() {
            return Duration.ofMillis(killGraceMs);
        }
    }
}
