package com.cybergrader.modules.content;

import com.cybergrader.exception.ContentValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads lab, quiz and exam definitions from {@code labs/*.yml},
 * {@code quizzes/*.yml} and {@code exams/*.yml} under a content root.
 * Files are read in lexical filename order. The first malformed file aborts
 * the load with a {@link ContentValidationException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentLoader {

    private static final ObjectMapper YAML = YAMLMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Validator validator;

    public ContentSnapshot loadAll(Path root, String defaultVersion) {
        List<LabDefinition> labs = loadLabs(root, defaultVersion);
        List<QuizDefinition> quizzes = loadQuizzes(root, defaultVersion);
        List<ExamDefinition> exams = loadExams(root, defaultVersion);
        return new ContentSnapshot(labs, quizzes, exams);
    }

    public List<LabDefinition> loadLabs(Path root, String defaultVersion) {
        return load(root.resolve("labs"), LabDefinition.class, lab -> {
            checkLab(lab);
            return lab.getVersion() == null ? lab.toBuilder().version(defaultVersion).build() : lab;
        });
    }

    public List<QuizDefinition> loadQuizzes(Path root, String defaultVersion) {
        return load(root.resolve("quizzes"), QuizDefinition.class, quiz -> {
            requireUnique(quiz.getQuestions().stream().map(QuizQuestion::getId), "question id", quiz.getId());
            return quiz.getVersion() == null ? quiz.toBuilder().version(defaultVersion).build() : quiz;
        });
    }

    public List<ExamDefinition> loadExams(Path root, String defaultVersion) {
        return load(root.resolve("exams"), ExamDefinition.class, exam -> {
            requireUnique(exam.getStages().stream().map(ExamStageDefinition::getId), "stage id", exam.getId());
            return exam.getVersion() == null ? exam.toBuilder().version(defaultVersion).build() : exam;
        });
    }

    private <T> List<T> load(Path directory, Class<T> type, Function<T, T> finisher) {
        List<T> definitions = new ArrayList<>();
        for (Path file : definitionFiles(directory)) {
            T definition = parse(file, type);
            try {
                definitions.add(finisher.apply(definition));
            } catch (InvalidDefinition e) {
                throw new ContentValidationException(file.toString(), List.of(e.getMessage()));
            }
        }
        log.debug("Loaded {} {} definition(s) from {}", definitions.size(), type.getSimpleName(), directory);
        return definitions;
    }

    private List<Path> definitionFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".yml"))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new ContentValidationException(directory.toString(), "directory cannot be listed", e);
        }
    }

    private <T> T parse(Path file, Class<T> type) {
        T definition;
        try {
            definition = YAML.readValue(file.toFile(), type);
        } catch (JsonProcessingException e) {
            throw new ContentValidationException(file.toString(), String.valueOf(e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new ContentValidationException(file.toString(), "file cannot be read", e);
        }
        if (definition == null) {
            throw new ContentValidationException(file.toString(), List.of("document is empty"));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(definition);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
            throw new ContentValidationException(file.toString(), messages);
        }
        return definition;
    }

    private void checkLab(LabDefinition lab) {
        requireUnique(lab.getFlags().stream().map(FlagDefinition::getName), "flag name", lab.getId());
        for (FlagDefinition flag : lab.getFlags()) {
            if (flag.getValidator() == FlagValidatorKind.EXACT
                    && (flag.getValue() == null || flag.getValue().isEmpty())) {
                throw new InvalidDefinition("flag '" + flag.getName() + "': exact validator requires a value");
            }
            if (flag.getValidator() == FlagValidatorKind.REGEX && flag.getPattern() != null) {
                try {
                    Pattern.compile(flag.getPattern());
                } catch (PatternSyntaxException e) {
                    throw new InvalidDefinition("flag '" + flag.getName() + "': invalid pattern " + e.getDescription());
                }
            }
        }
    }

    private void requireUnique(Stream<String> ids, String what, String owner) {
        Set<String> seen = new HashSet<>();
        List<String> duplicates = ids.filter(id -> !seen.add(id)).distinct().toList();
        if (!duplicates.isEmpty()) {
            throw new InvalidDefinition("duplicate " + what + " in " + owner + ": "
                    + duplicates.stream().collect(Collectors.joining(", ")));
        }
    }

    public record ContentSnapshot(List<LabDefinition> labs,
                                  List<QuizDefinition> quizzes,
                                  List<ExamDefinition> exams) {}

    private static class InvalidDefinition extends RuntimeException {
        InvalidDefinition(String message) {
            super(message);
        }
    }
}
