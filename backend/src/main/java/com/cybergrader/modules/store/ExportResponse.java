package com.cybergrader.modules.store;

import java.util.List;

/** Every attempt of every user, ordered by submission time, then user id. */
public record ExportResponse(List<FlagSubmissionResult> labs,
                             List<QuizSubmissionResult> quizzes,
                             List<ExamSubmissionResult> exams) {}
