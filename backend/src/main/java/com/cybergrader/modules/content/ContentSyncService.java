package com.cybergrader.modules.content;

import com.cybergrader.config.GraderProperties;
import com.cybergrader.exception.ContentValidationException;
import com.cybergrader.modules.content.ContentLoader.ContentSnapshot;
import com.cybergrader.modules.notification.Notifier;
import com.cybergrader.modules.store.GradingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Loads every definition under the content root and swaps them into the store.
 * All three kinds are parsed and validated before anything is replaced, so a
 * malformed file leaves the previous content in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentSyncService {

    private static final DateTimeFormatter VERSION = DateTimeFormatter.ofPattern("yyyy.MM.dd");

    private final ContentLoader loader;
    private final ContentWorkspace workspace;
    private final GradingStore store;
    private final Notifier notifier;
    private final GraderProperties properties;
    private final Clock clock;

    private final ReentrantLock syncLock = new ReentrantLock();

    @EventListener(ApplicationReadyEvent.class)
    public void syncOnStartup() {
        if (!properties.getContent().isSyncOnStartup()) {
            log.info("Start-up content sync disabled");
            return;
        }
        try {
            syncAll(workspace.current());
        } catch (ContentValidationException e) {
            log.error("Start-up content sync failed, serving without content: {}", e.getMessage());
        }
    }

    /** Refreshes the content checkout, then syncs from it. */
    public SyncResponse refreshAndSync() {
        return syncAll(workspace.refresh());
    }

    public SyncResponse syncAll(ContentFetchResult provenance) {
        syncLock.lock();
        try {
            Path root = provenance.root();
            String version = LocalDate.now(clock).format(VERSION);
            ContentSnapshot snapshot;
            try {
                snapshot = loader.loadAll(root, version);
            } catch (ContentValidationException e) {
                notifier.notify("Content sync failed", e.getMessage());
                throw e;
            }

            store.replaceContent(snapshot.labs(), snapshot.quizzes(), snapshot.exams());

            SyncResponse response = new SyncResponse(
                    snapshot.labs().size(),
                    snapshot.quizzes().size(),
                    snapshot.exams().size(),
                    version,
                    provenance.source(),
                    provenance.branch(),
                    provenance.status(),
                    properties.getContent().getRefreshSchedule(),
                    properties.getStore().getBackupSchedule(),
                    provenance.refreshedAt());
            log.info("Synced {} lab(s), {} quiz(zes), {} exam(s) from {} (version {})",
                    response.labs(), response.quizzes(), response.exams(), root, version);
            notifier.notify("Content sync complete", String.format(
                    "labs: %d%nquizzes: %d%nexams: %d%nversion: %s%nsource: %s%nrefresh: %s",
                    response.labs(), response.quizzes(), response.exams(), version,
                    response.contentSource(), response.refreshStatus()));
            return response;
        } finally {
            syncLock.unlock();
        }
    }
}
