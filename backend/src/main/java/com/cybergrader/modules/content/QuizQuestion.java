package com.cybergrader.modules.content;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class QuizQuestion {

    @NotBlank(message = "question id is required")
    String id;

    @NotNull(message = "question prompt is required")
    String prompt;

    @NotNull(message = "question type is required")
    QuestionType type;

    @NotNull
    @Builder.Default
    List<@Valid @NotNull QuizChoice> choices = List.of();

    @NotNull(message = "question answer is required")
    String answer;

    @Min(value = 0, message = "question points must not be negative")
    @Builder.Default
    int points = 1;
}
