package com.cybergrader.modules.content;

import com.cybergrader.exception.ContentValidationException;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContentLoaderTest {

    @TempDir
    Path root;

    private ValidatorFactory validatorFactory;
    private ContentLoader loader;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        loader = new ContentLoader(validatorFactory.getValidator());
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    private void write(String relative, String yaml) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, yaml);
    }

    @Test
    void readsLabsInFilenameOrder() throws IOException {
        write("labs/b.yml", """
                id: second
                title: Second
                flags: []
                """);
        write("labs/a.yml", """
                id: first
                title: First
                version: "1.0"
                instructions: instructions/first.md
                flags:
                  - name: f1
                    prompt: Find it
                    validator: exact
                    value: FLAG{abc}
                  - name: f2
                    prompt: Match it
                    validator: regex
                    pattern: "FLAG\\\\{\\\\d+\\\\}"
                  - name: f3
                    prompt: Drop it
                    validator: file_exists
                """);
        write("labs/notes.txt", "ignored");

        List<LabDefinition> labs = loader.loadLabs(root, "2024.05.06");

        assertEquals(List.of("first", "second"), labs.stream().map(LabDefinition::getId).toList());
        LabDefinition first = labs.get(0);
        assertEquals("1.0", first.getVersion());
        assertEquals("instructions/first.md", first.getInstructionsPath());
        assertEquals(FlagValidatorKind.FILE_EXISTS, first.getFlags().get(2).getValidator());
        assertEquals("FLAG\\{\\d+\\}", first.getFlags().get(1).getPattern());
        assertEquals("2024.05.06", labs.get(1).getVersion());
    }

    @Test
    void readsQuizzesAndExamsWithDefaults() throws IOException {
        write("quizzes/q.yml", """
                id: q1
                title: Quiz
                questions:
                  - id: a
                    prompt: Pick
                    type: multiple_choice
                    choices:
                      - key: x
                        label: X
                    answer: x
                  - id: b
                    prompt: Say
                    type: short_answer
                    answer: Paris
                    points: 3
                """);
        write("exams/e.yml", """
                id: e1
                title: Exam
                stages:
                  - id: s1
                    title: Stage
                  - id: s2
                    title: Stage two
                    max_score: 25
                """);

        QuizDefinition quiz = loader.loadQuizzes(root, "v").get(0);
        ExamDefinition exam = loader.loadExams(root, "v").get(0);

        assertEquals(1, quiz.getQuestions().get(0).getPoints());
        assertEquals(QuestionType.SHORT_ANSWER, quiz.getQuestions().get(1).getType());
        assertEquals(4, quiz.maxScore());
        assertEquals(10, exam.getStages().get(0).getMaxScore());
        assertEquals(25, exam.getStages().get(1).getMaxScore());
    }

    @Test
    void missingDirectoriesLoadNothing() {
        ContentLoader.ContentSnapshot snapshot = loader.loadAll(root, "v");

        assertTrue(snapshot.labs().isEmpty());
        assertTrue(snapshot.quizzes().isEmpty());
        assertTrue(snapshot.exams().isEmpty());
    }

    @Test
    void exactFlagWithoutValueIsRejected() throws IOException {
        write("labs/bad.yml", """
                id: bad
                title: Bad
                flags:
                  - name: f1
                    prompt: Find it
                    validator: exact
                """);

        ContentValidationException ex = assertThrows(ContentValidationException.class,
                () -> loader.loadLabs(root, "v"));
        assertTrue(ex.getFile().endsWith("bad.yml"));
        assertTrue(ex.getMessage().contains("exact validator requires a value"));
    }

    @Test
    void duplicateFlagNamesAreRejected() throws IOException {
        write("labs/dup.yml", """
                id: dup
                title: Dup
                flags:
                  - name: f1
                    prompt: One
                    validator: exact
                    value: a
                  - name: f1
                    prompt: Two
                    validator: exact
                    value: b
                """);

        ContentValidationException ex = assertThrows(ContentValidationException.class,
                () -> loader.loadLabs(root, "v"));
        assertTrue(ex.getMessage().contains("duplicate flag name"));
    }

    @Test
    void unknownValidatorKindIsRejected() throws IOException {
        write("labs/kind.yml", """
                id: kind
                title: Kind
                flags:
                  - name: f1
                    prompt: One
                    validator: sha256
                """);

        assertThrows(ContentValidationException.class, () -> loader.loadLabs(root, "v"));
    }

    @Test
    void missingRequiredFieldsAreRejected() throws IOException {
        write("exams/e.yml", """
                title: No id
                stages: []
                """);

        ContentValidationException ex = assertThrows(ContentValidationException.class,
                () -> loader.loadExams(root, "v"));
        assertTrue(ex.getViolations().stream().anyMatch(v -> v.contains("exam id is required")));
    }

    @Test
    void uncompilablePatternIsRejected() throws IOException {
        write("labs/re.yml", """
                id: re
                title: Regex
                flags:
                  - name: f1
                    prompt: One
                    validator: regex
                    pattern: "FLAG{("
                """);

        assertThrows(ContentValidationException.class, () -> loader.loadLabs(root, "v"));
    }

    @Test
    void emptyDocumentIsRejected() throws IOException {
        write("quizzes/empty.yml", "");

        assertThrows(ContentValidationException.class, () -> loader.loadQuizzes(root, "v"));
    }
}
