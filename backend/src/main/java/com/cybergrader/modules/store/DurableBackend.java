package com.cybergrader.modules.store;

import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuizDefinition;

import java.util.List;

/**
 * Durable mirror of the grading store. Every method either completes or throws
 * {@link com.cybergrader.exception.PersistenceDegradedException}.
 */
public interface DurableBackend extends AutoCloseable {

    /** Short name reported by the health endpoint. */
    String name();

    /** Connects and creates the tables when they are missing. */
    void initialize();

    HydratedState hydrate();

    /** Upserts every lab by id and removes the rows of labs no longer present. */
    void replaceLabs(List<LabDefinition> labs);

    void replaceQuizzes(List<QuizDefinition> quizzes);

    void replaceExams(List<ExamDefinition> exams);

    void insertFlagResult(FlagSubmissionResult result);

    void insertQuizResult(QuizSubmissionResult result);

    void insertExamResult(ExamSubmissionResult result);

    @Override
    void close();
}
