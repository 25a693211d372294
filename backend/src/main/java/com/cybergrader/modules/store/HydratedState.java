package com.cybergrader.modules.store;

import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuizDefinition;

import java.util.List;

/** Everything a durable backend holds, in the order it should be replayed. */
public record HydratedState(List<LabDefinition> labs,
                            List<QuizDefinition> quizzes,
                            List<ExamDefinition> exams,
                            List<FlagSubmissionResult> flagResults,
                            List<QuizSubmissionResult> quizResults,
                            List<ExamSubmissionResult> examResults) {}
