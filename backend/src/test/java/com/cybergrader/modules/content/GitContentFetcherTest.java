package com.cybergrader.modules.content;

import com.cybergrader.MutableClock;
import com.cybergrader.config.GraderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GitContentFetcherTest {

    @TempDir
    Path workDir;

    private Path origin;
    private Path checkout;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        clock = new MutableClock(Instant.parse("2024-05-06T07:08:09Z"));
        origin = Files.createDirectories(workDir.resolve("origin"));
        checkout = workDir.resolve("checkout");

        git(origin, "init", "-q");
        git(origin, "symbolic-ref", "HEAD", "refs/heads/main");
        commit("labs/01.yml", "id: L1\ntitle: One\nflags: []\n");
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            return process.waitFor(30, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void git(Path dir, String... args) throws IOException, InterruptedException {
        List<String> command = new ArrayList<>(List.of("git",
                "-c", "user.name=Grader", "-c", "user.email=grader@example.com", "-c", "commit.gpgsign=false"));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command)
                .directory(dir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .start();
        assertTrue(process.waitFor(60, TimeUnit.SECONDS), "git timed out");
        assertEquals(0, process.exitValue(), "git " + String.join(" ", args));
    }

    private void commit(String relative, String body) throws IOException, InterruptedException {
        Path file = origin.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, body);
        git(origin, "add", "-A");
        git(origin, "commit", "-q", "-m", "Update " + relative);
    }

    private GitContentFetcher fetcher(String url) {
        return new GitContentFetcher(url, "main", checkout, clock);
    }

    @Test
    void prepareClonesTheBranch() {
        ContentFetchResult result = fetcher(origin.toUri().toString()).prepare();

        assertEquals("cloned", result.status());
        assertEquals(checkout.toAbsolutePath().normalize(), result.root());
        assertEquals("main", result.branch());
        assertEquals(clock.instant(), result.refreshedAt());
        assertTrue(Files.exists(checkout.resolve("labs/01.yml")));
    }

    @Test
    void refreshPicksUpNewCommits() throws Exception {
        GitContentFetcher fetcher = fetcher(origin.toUri().toString());
        fetcher.prepare();
        commit("labs/02.yml", "id: L2\ntitle: Two\nflags: []\n");

        ContentFetchResult result = fetcher.refresh();

        assertEquals("updated", result.status());
        assertTrue(Files.exists(checkout.resolve("labs/02.yml")));
    }

    @Test
    void prepareOnAnExistingCheckoutRefreshesIt() {
        fetcher(origin.toUri().toString()).prepare();

        assertEquals("updated", fetcher(origin.toUri().toString()).prepare().status());
    }

    @Test
    void refreshBeforeCloneIsMissing() {
        ContentFetchResult result = fetcher(origin.toUri().toString()).refresh();

        assertEquals("missing", result.status());
        assertFalse(result.failed());
    }

    @Test
    void unreachableRepositoryIsAnError() {
        ContentFetchResult result = fetcher(workDir.resolve("no-such-repo").toUri().toString()).prepare();

        assertTrue(result.failed());
        assertNotNull(result.message());
        assertFalse(result.message().isBlank());
    }

    @Test
    void workspaceFallsBackToBundledContentWhenCloneFails() {
        Path bundled = workDir.resolve("bundled");
        GraderProperties properties = new GraderProperties();
        properties.getContent().setRoot(bundled);

        ContentWorkspace workspace = new ContentWorkspace(fetcher(workDir.resolve("no-such-repo").toUri().toString()),
                properties);

        assertEquals("local", workspace.current().status());
        assertEquals(bundled.toAbsolutePath().normalize(), workspace.root());
    }
}
