package com.cybergrader.modules.store;

import java.util.List;

public record DashboardSummary(List<LabStatus> labs,
                               List<QuizSubmissionResult> quizzes,
                               List<ExamSubmissionResult> exams) {}
