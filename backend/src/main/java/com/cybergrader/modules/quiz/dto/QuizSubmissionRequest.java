package com.cybergrader.modules.quiz.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class QuizSubmissionRequest {

    @NotBlank(message = "user_id is required")
    private String userId;

    @NotNull
    private List<@Valid @NotNull Answer> answers = new ArrayList<>();

    @Data
    public static class Answer {

        @NotBlank(message = "question_id is required")
        private String questionId;

        private String answer;
    }
}
