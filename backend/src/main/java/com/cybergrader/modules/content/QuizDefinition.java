package com.cybergrader.modules.content;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class QuizDefinition {

    @NotBlank(message = "quiz id is required")
    String id;

    @NotBlank(message = "quiz title is required")
    String title;

    String version;

    @NotNull(message = "quiz questions must be a list")
    @Builder.Default
    List<@Valid @NotNull QuizQuestion> questions = List.of();

    public int maxScore() {
        return questions.stream().mapToInt(QuizQuestion::getPoints).sum();
    }
}
