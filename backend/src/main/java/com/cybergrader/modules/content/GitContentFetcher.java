package com.cybergrader.modules.content;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a shallow clone of the content repository up to date using the
 * {@code git} command line.
 */
@Slf4j
public class GitContentFetcher implements ContentFetcher {

    private static final Duration COMMAND_TIMEOUT = Duration.ofMinutes(2);

    private final String repoUrl;
    private final String branch;
    private final Path target;
    private final Clock clock;

    public GitContentFetcher(String repoUrl, String branch, Path target, Clock clock) {
        this.repoUrl = repoUrl;
        this.branch = branch;
        this.target = target.toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public ContentFetchResult prepare() {
        if (Files.isDirectory(target.resolve(".git"))) {
            return refresh();
        }
        if (Files.exists(target)) {
            log.warn("Target directory {} exists but is not a git repository", target);
        }
        try {
            Files.createDirectories(target.getParent());
        } catch (IOException e) {
            return error("Cannot create " + target.getParent() + ": " + e.getMessage());
        }
        String failure = run(List.of("git", "clone", "--depth", "1", "--branch", branch, repoUrl, target.toString()),
                target.getParent());
        if (failure != null) {
            log.error("Failed to clone content repository {}: {}", repoUrl, failure);
            return error(failure);
        }
        log.info("Cloned content repository {} ({}) into {}", repoUrl, branch, target);
        return new ContentFetchResult("cloned", target, repoUrl, branch, clock.instant(), null);
    }

    @Override
    public ContentFetchResult refresh() {
        if (!Files.isDirectory(target.resolve(".git"))) {
            return new ContentFetchResult("missing", target, repoUrl, branch, null,
                    "Repository has not been cloned yet");
        }
        List<List<String>> commands = List.of(
                List.of("git", "fetch", "origin", branch),
                List.of("git", "checkout", branch),
                List.of("git", "reset", "--hard", "origin/" + branch));
        for (List<String> command : commands) {
            String failure = run(command, target);
            if (failure != null) {
                log.error("Git command failed: {} - {}", String.join(" ", command), failure);
                return error(failure);
            }
        }
        log.info("Refreshed content repository {} ({})", repoUrl, branch);
        return new ContentFetchResult("updated", target, repoUrl, branch, clock.instant(), null);
    }

    /**
     * Runs a command and returns its output when it fails, or {@code null} on success.
     * Output goes to a temporary file so a chatty command can never fill the pipe and stall.
     */
    private String run(List<String> command, Path workingDirectory) {
        Path output = null;
        try {
            output = Files.createTempFile("grader-git-", ".log");
            Process process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (!process.waitFor(COMMAND_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return "timed out after " + COMMAND_TIMEOUT.toSeconds() + "s";
            }
            if (process.exitValue() == 0) {
                return null;
            }
            String text = Files.readString(output, StandardCharsets.UTF_8).trim();
            return text.isEmpty() ? "exit code " + process.exitValue() : text;
        } catch (IOException e) {
            return e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        } finally {
            if (output != null) {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", output, e.getMessage());
                }
            }
        }
    }

    private ContentFetchResult error(String message) {
        return new ContentFetchResult("error", target, repoUrl, branch, null, message);
    }
}
