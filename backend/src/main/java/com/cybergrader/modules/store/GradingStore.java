package com.cybergrader.modules.store;

import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.FlagDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuizDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Content definitions plus the attempt ledgers, with scoring and aggregation.
 * Every implementation must answer the read operations exactly as the
 * in-memory {@link CoreStore} would for the same sequence of writes.
 */
public interface GradingStore {

    void setLabs(List<LabDefinition> labs);

    void setQuizzes(List<QuizDefinition> quizzes);

    void setExams(List<ExamDefinition> exams);

    /**
     * Replaces all three definition sets in one step. Readers see either the
     * previous content or the new content, never a mix of the two.
     */
    void replaceContent(List<LabDefinition> labs, List<QuizDefinition> quizzes, List<ExamDefinition> exams);

    Optional<LabDefinition> findLab(String labId);

    Optional<QuizDefinition> findQuiz(String quizId);

    Optional<ExamDefinition> findExam(String examId);

    List<QuizDefinition> quizzes();

    List<ExamDefinition> exams();

    FlagSubmissionResult recordFlagSubmission(String labId, FlagDefinition flag, String userId, String submission);

    QuizSubmissionResult recordQuizSubmission(QuizDefinition quiz, String userId, Map<String, String> answers);

    ExamSubmissionResult recordExamSubmission(ExamDefinition exam, String userId, String stageId,
                                              Map<String, String> answers);

    List<LabStatus> labStatusForUser(String userId);

    DashboardSummary dashboardForUser(String userId);

    ExportResponse exportAll();

    StoreHealth health();
}
