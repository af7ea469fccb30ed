package com.gitcli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gitcli.command.DiffNumstatCommand;
import com.gitcli.command.DiffOptions;
import com.gitcli.command.DiffPatchCommand;
import com.gitcli.command.DiffRawCommand;
import com.gitcli.command.FsckCommand;
import com.gitcli.command.FsckOptions;
import com.gitcli.command.StatusCommand;
import com.gitcli.command.StatusOptions;
import com.gitcli.command.VersionCommand;
import com.gitcli.exec.GitCommandRunner;
import com.gitcli.exec.GitContext;
import com.gitcli.exec.GitDefaults;
import com.gitcli.exec.RunOptions;
import com.gitcli.parse.UnexpectedResultException;
import com.gitcli.runtime.AppConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
        name = "gitcli",
        mixinStandardHelpOptions = true,
        version = "gitcli 0.1.0",
        description = "Runs git and prints its parsed output as JSON.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_GIT_FAILURE = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "What to run: ${COMPLETION-CANDIDATES}", defaultValue = "status")
    Mode mode;

    @Option(names = "--repo-path", description = "Working tree of the repository", defaultValue = ".")
    Path repoPath;

    @Option(names = "--commit", description = "Commit to diff against; give twice for a commit pair")
    List<String> commits = new ArrayList<>();

    @Option(names = "--cached", description = "Diff the index instead of the working tree", defaultValue = "false")
    boolean cached;

    @Option(names = "--dirstat", description = "Also report per-directory change percentages", defaultValue = "false")
    boolean dirstat;

    @Option(names = "--ignored", description = "Include ignored files in status mode", defaultValue = "false")
    boolean ignored;

    @Option(names = "--timeout-ms", description = "Kill git after this many milliseconds; overrides the config file")
    Long timeoutMs;

    @Parameters(arity = "0..*", description = "Pathspecs limiting diff and status, objects for fsck")
    List<String> pathspecs = new ArrayList<>();

    PrintStream out = System.out;
    PrintStream err = System.err;

    enum Mode {
        version,
        diff,
        numstat,
        patch,
        status,
        fsck
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        Object result;
        try {
            AppConfig.GitConfig gitConfig = loadConfig(configPath).getGit();
            GitDefaults.set(gitConfig.toDefaults());
            RunOptions runOptions = gitConfig.toRunOptions();
            if (timeoutMs != null) {
                runOptions = runOptions.withTimeout(Duration.ofMillis(timeoutMs));
            }
            GitContext context = GitContext.builder()
                    .workTree(mode == Mode.version ? null : repoPath.toAbsolutePath().normalize())
                    .locale(gitConfig.getLocale())
                    .runner(new GitCommandRunner(gitConfig.killGrace()))
                    .build();

            log.info("Running mode={} repo={} config={}", mode, repoPath, configPath);
            result = run(context, runOptions);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected arguments", e);
            err.println("Invalid arguments: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException | UnexpectedResultException e) {
            log.error("git invocation failed: {}", e.getMessage());
            err.println("git failed: " + e.getMessage());
            return EXIT_GIT_FAILURE;
        }

        out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
        return EXIT_OK;
    }

    private Object run(GitContext context, RunOptions runOptions) throws IOException, InterruptedException {
        return switch (mode) {
            case version -> new VersionCommand(context).call();
            case diff -> new DiffRawCommand(context, runOptions).call(diffOptions());
            case numstat -> new DiffNumstatCommand(context, runOptions).call(diffOptions());
            case patch -> new DiffPatchCommand(context, runOptions).call(diffOptions());
            case status -> new StatusCommand(context, runOptions)
                    .call(StatusOptions.defaults().withIgnored(ignored).withPathspecs(pathspecs));
            case fsck -> new FsckCommand(context, runOptions)
                    .call(FsckOptions.builder().objects(pathspecs).build());
        };
    }

    DiffOptions diffOptions() {
        if (commits.size() > 2) {
            throw new IllegalArgumentException("At most two --commit values are allowed, got " + commits.size());
        }
        return DiffOptions.builder()
                .commit1(commits.isEmpty() ? null : commits.get(0))
                .commit2(commits.size() < 2 ? null : commits.get(1))
                .cached(cached)
                .dirstat(dirstat ? "" : null)
                .pathspecs(pathspecs)
                .build();
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
