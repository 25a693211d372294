package com.cybergrader.scheduler;

import com.cybergrader.config.GraderProperties;
import com.cybergrader.exception.ContentValidationException;
import com.cybergrader.modules.content.ContentSyncService;
import com.cybergrader.modules.content.SyncResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ContentRefreshScheduler {

    private final ContentSyncService syncService;
    private final GraderProperties properties;

    /** Pulls the content repository and re-syncs, when enabled. Defaults to 03:00 daily. */
    @Scheduled(cron = "${grader.content.refresh-cron:0 0 3 * * *}")
    public void refreshContent() {
        if (!properties.getContent().isRefreshEnabled()) {
            return;
        }
        log.info("Scheduled content refresh ({})", properties.getContent().getRefreshSchedule());
        try {
            SyncResponse response = syncService.refreshAndSync();
            log.info("Scheduled content refresh complete: {} lab(s), {} quiz(zes), {} exam(s), refresh {}",
                    response.labs(), response.quizzes(), response.exams(), response.refreshStatus());
        } catch (ContentValidationException e) {
            log.error("Scheduled content refresh rejected, previous content kept: {}", e.getMessage());
        }
    }
}
