package com.cybergrader.modules.store;

import com.cybergrader.exception.ResourceNotFoundException;
import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.FlagDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuizDefinition;
import com.cybergrader.modules.grading.SubmissionValidator;
import com.cybergrader.modules.grading.SubmissionValidator.QuizScore;
import com.cybergrader.modules.grading.SubmissionValidator.StageScore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory store holding the definition maps and attempt ledgers. This is the
 * read-of-record for every backend; persistent stores wrap it.
 */
@Slf4j
public class CoreStore implements GradingStore {

    static final String INSTRUCTIONS_NOT_FOUND = "Instructions not found";

    private final Supplier<Path> contentRoot;
    private final SubmissionValidator validator;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Map<String, LabDefinition> labs = Map.of();
    private Map<String, QuizDefinition> quizzes = Map.of();
    private Map<String, ExamDefinition> exams = Map.of();

    private final AttemptLedger<AttemptKeys.Flag, FlagSubmissionResult> flagAttempts = new AttemptLedger<>();
    private final AttemptLedger<AttemptKeys.Quiz, QuizSubmissionResult> quizAttempts = new AttemptLedger<>();
    private final AttemptLedger<AttemptKeys.ExamStage, ExamSubmissionResult> examAttempts = new AttemptLedger<>();

    public CoreStore(Supplier<Path> contentRoot, SubmissionValidator validator, Clock clock) {
        this.contentRoot = contentRoot;
        this.validator = validator;
        this.clock = clock;
    }

    // -------------------------------------------------------------------------
    // Content
    // -------------------------------------------------------------------------

    @Override
    public void setLabs(List<LabDefinition> labs) {
        Map<String, LabDefinition> next = index(labs, LabDefinition::getId);
        write(() -> this.labs = next);
    }

    @Override
    public void setQuizzes(List<QuizDefinition> quizzes) {
        Map<String, QuizDefinition> next = index(quizzes, QuizDefinition::getId);
        write(() -> this.quizzes = next);
    }

    @Override
    public void setExams(List<ExamDefinition> exams) {
        Map<String, ExamDefinition> next = index(exams, ExamDefinition::getId);
        write(() -> this.exams = next);
    }

    @Override
    public void replaceContent(List<LabDefinition> labs, List<QuizDefinition> quizzes,
                               List<ExamDefinition> exams) {
        Map<String, LabDefinition> nextLabs = index(labs, LabDefinition::getId);
        Map<String, QuizDefinition> nextQuizzes = index(quizzes, QuizDefinition::getId);
        Map<String, ExamDefinition> nextExams = index(exams, ExamDefinition::getId);
        write(() -> {
            this.labs = nextLabs;
            this.quizzes = nextQuizzes;
            this.exams = nextExams;
        });
    }

    @Override
    public Optional<LabDefinition> findLab(String labId) {
        return read(() -> Optional.ofNullable(labs.get(labId)));
    }

    @Override
    public Optional<QuizDefinition> findQuiz(String quizId) {
        return read(() -> Optional.ofNullable(quizzes.get(quizId)));
    }

    @Override
    public Optional<ExamDefinition> findExam(String examId) {
        return read(() -> Optional.ofNullable(exams.get(examId)));
    }

    @Override
    public List<QuizDefinition> quizzes() {
        return read(() -> List.copyOf(quizzes.values()));
    }

    @Override
    public List<ExamDefinition> exams() {
        return read(() -> List.copyOf(exams.values()));
    }

    // -------------------------------------------------------------------------
    // Submissions
    // -------------------------------------------------------------------------

    @Override
    public FlagSubmissionResult recordFlagSubmission(String labId, FlagDefinition flag, String userId,
                                                     String submission) {
        lock.writeLock().lock();
        try {
            LabDefinition lab = labs.get(labId);
            if (lab == null) {
                throw new ResourceNotFoundException("Lab", labId);
            }
            if (lab.findFlag(flag.getName()).isEmpty()) {
                throw new ResourceNotFoundException("Flag", flag.getName());
            }
            boolean correct = validator.isFlagCorrect(flag, submission, contentRoot.get());
            FlagSubmissionResult result = new FlagSubmissionResult(userId, labId, flag.getName(), correct, now());
            flagAttempts.append(new AttemptKeys.Flag(userId, labId, flag.getName()), result);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public QuizSubmissionResult recordQuizSubmission(QuizDefinition quiz, String userId, Map<String, String> answers) {
        QuizScore score = validator.scoreQuiz(quiz, answers);
        lock.writeLock().lock();
        try {
            QuizSubmissionResult result = new QuizSubmissionResult(userId, quiz.getId(), score.score(),
                    score.maxScore(), now());
            quizAttempts.append(new AttemptKeys.Quiz(userId, quiz.getId()), result);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public ExamSubmissionResult recordExamSubmission(ExamDefinition exam, String userId, String stageId,
                                                     Map<String, String> answers) {
        StageScore score = validator.scoreExamStage(exam, stageId, answers);
        lock.writeLock().lock();
        try {
            ExamSubmissionResult result = new ExamSubmissionResult(userId, exam.getId(), stageId, score.score(),
                    score.stage().getMaxScore(), now());
            examAttempts.append(new AttemptKeys.ExamStage(userId, exam.getId(), stageId), result);
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Aggregation
    // -------------------------------------------------------------------------

    @Override
    public List<LabStatus> labStatusForUser(String userId) {
        return read(() -> labs.values().stream()
                .map(lab -> new LabStatus(
                        lab.getId(),
                        lab.getTitle(),
                        lab.getVersion(),
                        instructions(lab),
                        labScore(userId, lab),
                        lab.getFlags().size(),
                        lab.getFlags().stream()
                                .map(f -> new LabStatus.LabFlagPrompt(f.getName(), f.getPrompt(), f.getValidator(),
                                        f.getPattern()))
                                .toList()))
                .toList());
    }

    @Override
    public DashboardSummary dashboardForUser(String userId) {
        return read(() -> new DashboardSummary(
                labStatusForUser(userId),
                quizAttempts.filter(a -> a.userId().equals(userId)),
                examAttempts.filter(a -> a.userId().equals(userId))));
    }

    @Override
    public ExportResponse exportAll() {
        return read(() -> new ExportResponse(
                chronological(flagAttempts.all(), FlagSubmissionResult::submittedAt, FlagSubmissionResult::userId),
                chronological(quizAttempts.all(), QuizSubmissionResult::submittedAt, QuizSubmissionResult::userId),
                chronological(examAttempts.all(), ExamSubmissionResult::submittedAt, ExamSubmissionResult::userId)));
    }

    @Override
    public StoreHealth health() {
        return new StoreHealth("memory", false, false, 0);
    }

    /** Replaces all state with what a durable backend holds. */
    void restore(HydratedState state) {
        Map<String, LabDefinition> nextLabs = index(state.labs(), LabDefinition::getId);
        Map<String, QuizDefinition> nextQuizzes = index(state.quizzes(), QuizDefinition::getId);
        Map<String, ExamDefinition> nextExams = index(state.exams(), ExamDefinition::getId);
        write(() -> {
            labs = nextLabs;
            quizzes = nextQuizzes;
            exams = nextExams;
            flagAttempts.clear();
            quizAttempts.clear();
            examAttempts.clear();
            state.flagResults().forEach(r ->
                    flagAttempts.append(new AttemptKeys.Flag(r.userId(), r.labId(), r.flagName()), r));
            state.quizResults().forEach(r -> quizAttempts.append(new AttemptKeys.Quiz(r.userId(), r.quizId()), r));
            state.examResults().forEach(r ->
                    examAttempts.append(new AttemptKeys.ExamStage(r.userId(), r.examId(), r.stageId()), r));
        });
    }

    // Distinct flags of the lab with at least one correct attempt, ever.
    private int labScore(String userId, LabDefinition lab) {
        return (int) lab.getFlags().stream()
                .map(FlagDefinition::getName)
                .distinct()
                .filter(name -> flagAttempts.anyMatch(new AttemptKeys.Flag(userId, lab.getId(), name),
                        FlagSubmissionResult::correct))
                .count();
    }

    private String instructions(LabDefinition lab) {
        if (lab.getInstructionsPath() == null || lab.getInstructionsPath().isBlank()) {
            return INSTRUCTIONS_NOT_FOUND;
        }
        Path path = contentRoot.get().resolve(lab.getInstructionsPath());
        if (!Files.isRegularFile(path)) {
            return INSTRUCTIONS_NOT_FOUND;
        }
        try {
            return Files.readString(path);
        } catch (IOException e) {
            log.warn("Cannot read instructions for lab {} at {}: {}", lab.getId(), path, e.getMessage());
            return INSTRUCTIONS_NOT_FOUND;
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static <T> List<T> chronological(List<T> attempts, Function<T, Instant> submittedAt,
                                              Function<T, String> userId) {
        List<T> sorted = new ArrayList<>(attempts);
        sorted.sort(Comparator.comparing(submittedAt).thenComparing(userId));
        return List.copyOf(sorted);
    }

    static <T> Map<String, T> index(List<T> definitions, Function<T, String> id) {
        Map<String, T> map = new LinkedHashMap<>();
        definitions.forEach(d -> map.put(id.apply(d), d));
        return map;
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
