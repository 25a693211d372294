package com.cybergrader.modules.store;

import java.time.Instant;

public record ExamSubmissionResult(String userId,
                                   String examId,
                                   String stageId,
                                   int score,
                                   int maxScore,
                                   Instant submittedAt) {}
