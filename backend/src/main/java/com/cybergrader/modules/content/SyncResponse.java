package com.cybergrader.modules.content;

import java.time.Instant;

/** Counts of the definitions now live, plus where they came from. */
public record SyncResponse(int labs,
                           int quizzes,
                           int exams,
                           String version,
                           String contentSource,
                           String repoBranch,
                           String refreshStatus,
                           String refreshSchedule,
                           String backupSchedule,
                           Instant refreshedAt) {}
