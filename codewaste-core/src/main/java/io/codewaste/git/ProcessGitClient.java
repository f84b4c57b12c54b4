package io.codewaste.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * {@link GitClient} that runs the {@code git} executable with {@code -C <root>}.
 *
 * <p>Calls block until git exits. A missing executable, a non-zero exit
 * status or an interrupted wait all yield no data.</p>
 */
public class ProcessGitClient implements GitClient {

    private static final Logger log = LoggerFactory.getLogger(ProcessGitClient.class);

    private final Path root;
    private final String executable;

    public ProcessGitClient(Path root) {
        this(root, "git");
    }

    public ProcessGitClient(Path root, String executable) {
        this.root = root;
        this.executable = executable;
    }

    @Override
    public boolean isWorkTree() {
        return run(List.of("rev-parse", "--is-inside-work-tree"))
            .map(output -> output.strip().toLowerCase(Locale.ROOT).equals("true"))
            .orElse(false);
    }

    @Override
    public Optional<List<CommitRef>> fileHistory(String filePath) {
        return run(List.of("log", "--follow", "--format=%H|%an", "--", filePath))
            .map(ProcessGitClient::parseHistory);
    }

    static List<CommitRef> parseHistory(String output) {
        Set<String> seen = new LinkedHashSet<>();
        List<CommitRef> commits = new ArrayList<>();
        for (String line : output.split("\n")) {
            int separator = line.indexOf('|');
            if (separator < 0) {
                continue;
            }
            String commit = line.substring(0, separator).strip();
            String author = line.substring(separator + 1).strip();
            if (!commit.isEmpty() && seen.add(commit)) {
                commits.add(new CommitRef(commit, author));
            }
        }
        return commits;
    }

    @Override
    public Optional<List<BlameLine>> blame(String filePath, int startLine, int endLine) {
        return run(List.of("blame", "--line-porcelain", "-L", startLine + "," + endLine, "--", filePath))
            .map(BlamePorcelainParser::parse);
    }

    private Optional<String> run(List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-C");
        command.add(root.toString());
        command.addAll(args);

        ProcessBuilder pb = new ProcessBuilder(command)
            .redirectError(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = pb.start();
            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                log.debug("git {} exited with {}", args.get(0), exitCode);
                return Optional.empty();
            }
            return Optional.of(output);
        } catch (IOException e) {
            log.debug("Failed to run git: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for git {}", args.get(0));
            return Optional.empty();
        }
    }
}
