package com.cybergrader.modules.store;

import java.time.Instant;

public record QuizSubmissionResult(String userId,
                                   String quizId,
                                   int score,
                                   int maxScore,
                                   Instant submittedAt) {}
