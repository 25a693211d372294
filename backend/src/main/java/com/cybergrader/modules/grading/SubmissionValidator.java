package com.cybergrader.modules.grading;

import com.cybergrader.exception.ResourceNotFoundException;
import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.ExamStageDefinition;
import com.cybergrader.modules.content.FlagDefinition;
import com.cybergrader.modules.content.QuestionType;
import com.cybergrader.modules.content.QuizDefinition;
import com.cybergrader.modules.content.QuizQuestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a flag, quiz or exam-stage submission is correct. Apart from
 * the {@code file_exists} check, which looks at the content root, every method
 * is a pure function of its arguments.
 */
@Slf4j
@Component
public class SubmissionValidator {

    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    public boolean isFlagCorrect(FlagDefinition flag, String submission, Path contentRoot) {
        if (flag.getValidator() == null) {
            return false;
        }
        String submitted = submission == null ? "" : submission.trim();
        return switch (flag.getValidator()) {
            case EXACT -> flag.getValue() != null && submitted.equals(flag.getValue().trim());
            case REGEX -> flag.getPattern() != null
                    && compiled(flag.getPattern()).map(p -> p.matcher(submitted).matches()).orElse(false);
            case FILE_EXISTS -> fileExists(contentRoot, submitted);
        };
    }

    /**
     * Multiple-choice answers must equal the key exactly; short answers are
     * compared trimmed and case-insensitively. Unanswered questions score zero.
     */
    public QuizScore scoreQuiz(QuizDefinition quiz, Map<String, String> answers) {
        int score = 0;
        for (QuizQuestion question : quiz.getQuestions()) {
            String submitted = answers.get(question.getId());
            if (submitted != null && isAnswerCorrect(question, submitted)) {
                score += question.getPoints();
            }
        }
        return new QuizScore(score, quiz.maxScore());
    }

    /**
     * Placeholder policy: a stage earns its full score as soon as any answer
     * is non-blank, and nothing otherwise. Answer content is not graded.
     */
    public StageScore scoreExamStage(ExamDefinition exam, String stageId, Map<String, String> answers) {
        ExamStageDefinition stage = exam.findStage(stageId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam stage", stageId));
        boolean answered = answers.values().stream().anyMatch(a -> a != null && !a.isBlank());
        return new StageScore(stage, answered ? stage.getMaxScore() : 0);
    }

    private boolean isAnswerCorrect(QuizQuestion question, String submitted) {
        if (question.getType() == null || question.getAnswer() == null) {
            return false;
        }
        if (question.getType() == QuestionType.MULTIPLE_CHOICE) {
            return submitted.equals(question.getAnswer());
        }
        return submitted.trim().toLowerCase(Locale.ROOT)
                .equals(question.getAnswer().trim().toLowerCase(Locale.ROOT));
    }

    // Only paths that stay inside the content root count.
    private boolean fileExists(Path contentRoot, String submitted) {
        if (submitted.isEmpty() || contentRoot == null) {
            return false;
        }
        try {
            Path root = contentRoot.toAbsolutePath().normalize();
            Path target = root.resolve(submitted).normalize();
            return target.startsWith(root) && !target.equals(root) && Files.exists(target);
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private Optional<Pattern> compiled(String pattern) {
        return patterns.computeIfAbsent(pattern, p -> {
            try {
                return Optional.of(Pattern.compile(p));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid flag pattern '{}': {}", p, e.getDescription());
                return Optional.empty();
            }
        });
    }

    public record QuizScore(int score, int maxScore) {}

    public record StageScore(ExamStageDefinition stage, int score) {}
}
