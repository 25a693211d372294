package com.cybergrader;

import com.cybergrader.modules.content.ExamDefinition;
import com.cybergrader.modules.content.ExamStageDefinition;
import com.cybergrader.modules.content.FlagDefinition;
import com.cybergrader.modules.content.FlagValidatorKind;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.content.QuestionType;
import com.cybergrader.modules.content.QuizChoice;
import com.cybergrader.modules.content.QuizDefinition;
import com.cybergrader.modules.content.QuizQuestion;

import java.util.List;

/** Definitions shared by the store and validator tests. */
public final class TestContent {

    private TestContent() {
    }

    public static FlagDefinition exactFlag(String name, String value) {
        return FlagDefinition.builder()
                .name(name)
                .prompt("Submit " + name)
                .validator(FlagValidatorKind.EXACT)
                .value(value)
                .build();
    }

    public static FlagDefinition regexFlag(String name, String pattern) {
        return FlagDefinition.builder()
                .name(name)
                .prompt("Submit " + name)
                .validator(FlagValidatorKind.REGEX)
                .pattern(pattern)
                .build();
    }

    /** Lab L1 with one exact flag f1 = FLAG{abc}. */
    public static LabDefinition labL1() {
        return LabDefinition.builder()
                .id("L1")
                .title("Lab one")
                .version("2024.01.01")
                .flags(List.of(exactFlag("f1", "FLAG{abc}")))
                .build();
    }

    /** Quiz q1: multiple choice q1a (answer b, 2 points), short answer q1b (Paris, 3 points). */
    public static QuizDefinition quizQ1() {
        return QuizDefinition.builder()
                .id("q1")
                .title("Quiz one")
                .version("2024.01.01")
                .questions(List.of(
                        QuizQuestion.builder()
                                .id("q1a")
                                .prompt("Pick b")
                                .type(QuestionType.MULTIPLE_CHOICE)
                                .choices(List.of(
                                        QuizChoice.builder().key("a").label("A").build(),
                                        QuizChoice.builder().key("b").label("B").build()))
                                .answer("b")
                                .points(2)
                                .build(),
                        QuizQuestion.builder()
                                .id("q1b")
                                .prompt("Capital of France")
                                .type(QuestionType.SHORT_ANSWER)
                                .answer("Paris")
                                .points(3)
                                .build()))
                .build();
    }

    /** Exam e1 with a single stage s1 worth 10. */
    public static ExamDefinition examE1() {
        return ExamDefinition.builder()
                .id("e1")
                .title("Exam one")
                .version("2024.01.01")
                .stages(List.of(ExamStageDefinition.builder().id("s1").title("Stage one").maxScore(10).build()))
                .build();
    }
}
