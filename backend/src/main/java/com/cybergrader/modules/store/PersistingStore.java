package com.cybergrader.modules.store;

import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.FlagDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuizDefinition;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link CoreStore} mirrored to a {@link DurableBackend}.
 * <p>
 * Reads always come from the core store. Each write is applied in memory
 * first and then, synchronously, to the backend. A failed durable write is
 * logged and counted but never reaches the caller. If the backend cannot be
 * initialised or hydrated the store runs memory-only for the rest of the
 * process.
 */
@Slf4j
public class PersistingStore implements GradingStore, AutoCloseable {

    private final CoreStore core;
    private final DurableBackend backend;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong failedWrites = new AtomicLong();
    private volatile boolean enabled;

    public PersistingStore(CoreStore core, DurableBackend backend) {
        this.core = core;
        this.backend = backend;
    }

    /** Creates the schema and loads the durable state into memory. */
    public void start() {
        try {
            backend.initialize();
            HydratedState state = backend.hydrate();
            core.restore(state);
            enabled = true;
            log.info("Store backend '{}' ready: {} lab(s), {} quiz(zes), {} exam(s), {} attempt(s) hydrated",
                    backend.name(), state.labs().size(), state.quizzes().size(), state.exams().size(),
                    state.flagResults().size() + state.quizResults().size() + state.examResults().size());
        } catch (RuntimeException e) {
            enabled = false;
            log.warn("Store backend '{}' unavailable, continuing in memory only: {}", backend.name(), e.getMessage());
        }
    }

    @Override
    public void setLabs(List<LabDefinition> labs) {
        List<LabDefinition> current = List.copyOf(CoreStore.index(labs, LabDefinition::getId).values());
        writeThrough(() -> core.setLabs(current), "labs", () -> backend.replaceLabs(current));
    }

    @Override
    public void setQuizzes(List<QuizDefinition> quizzes) {
        List<QuizDefinition> current = List.copyOf(CoreStore.index(quizzes, QuizDefinition::getId).values());
        writeThrough(() -> core.setQuizzes(current), "quizzes", () -> backend.replaceQuizzes(current));
    }

    @Override
    public void setExams(List<ExamDefinition> exams) {
        List<ExamDefinition> current = List.copyOf(CoreStore.index(exams, ExamDefinition::getId).values());
        writeThrough(() -> core.setExams(current), "exams", () -> backend.replaceExams(current));
    }

    @Override
    public void replaceContent(List<LabDefinition> labs, List<QuizDefinition> quizzes,
                               List<ExamDefinition> exams) {
        List<LabDefinition> nextLabs = List.copyOf(CoreStore.index(labs, LabDefinition::getId).values());
        List<QuizDefinition> nextQuizzes = List.copyOf(CoreStore.index(quizzes, QuizDefinition::getId).values());
        List<ExamDefinition> nextExams = List.copyOf(CoreStore.index(exams, ExamDefinition::getId).values());
        writeLock.lock();
        try {
            core.replaceContent(nextLabs, nextQuizzes, nextExams);
            mirror("labs", () -> backend.replaceLabs(nextLabs));
            mirror("quizzes", () -> backend.replaceQuizzes(nextQuizzes));
            mirror("exams", () -> backend.replaceExams(nextExams));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public FlagSubmissionResult recordFlagSubmission(String labId, FlagDefinition flag, String userId,
                                                     String submission) {
        writeLock.lock();
        try {
            FlagSubmissionResult result = core.recordFlagSubmission(labId, flag, userId, submission);
            mirror("lab_submissions", () -> backend.insertFlagResult(result));
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public QuizSubmissionResult recordQuizSubmission(QuizDefinition quiz, String userId, Map<String, String> answers) {
        writeLock.lock();
        try {
            QuizSubmissionResult result = core.recordQuizSubmission(quiz, userId, answers);
            mirror("quiz_submissions", () -> backend.insertQuizResult(result));
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public ExamSubmissionResult recordExamSubmission(ExamDefinition exam, String userId, String stageId,
                                                     Map<String, String> answers) {
        writeLock.lock();
        try {
            ExamSubmissionResult result = core.recordExamSubmission(exam, userId, stageId, answers);
            mirror("exam_submissions", () -> backend.insertExamResult(result));
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<LabDefinition> findLab(String labId) {
        return core.findLab(labId);
    }

    @Override
    public Optional<QuizDefinition> findQuiz(String quizId) {
        return core.findQuiz(quizId);
    }

    @Override
    public Optional<ExamDefinition> findExam(String examId) {
        return core.findExam(examId);
    }

    @Override
    public List<QuizDefinition> quizzes() {
        return core.quizzes();
    }

    @Override
    public List<ExamDefinition> exams() {
        return core.exams();
    }

    @Override
    public List<LabStatus> labStatusForUser(String userId) {
        return core.labStatusForUser(userId);
    }

    @Override
    public DashboardSummary dashboardForUser(String userId) {
        return core.dashboardForUser(userId);
    }

    @Override
    public ExportResponse exportAll() {
        return core.exportAll();
    }

    @Override
    public StoreHealth health() {
        return new StoreHealth(backend.name(), true, enabled, failedWrites.get());
    }

    @Override
    public void close() {
        backend.close();
    }

    private void writeThrough(Runnable inMemory, String table, Runnable durable) {
        writeLock.lock();
        try {
            inMemory.run();
            mirror(table, durable);
        } finally {
            writeLock.unlock();
        }
    }

    // Caller holds the write lock.
    private void mirror(String table, Runnable durable) {
        if (!enabled) {
            return;
        }
        try {
            durable.run();
        } catch (RuntimeException e) {
            long failed = failedWrites.incrementAndGet();
            log.error("Durable write to {} on '{}' failed, memory is now ahead of the backend ({} failed write(s))",
                    table, backend.name(), failed, e);
        }
    }
}
