package com.cybergrader.modules.exam.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
public class ExamSubmissionRequest {

    @NotBlank(message = "user_id is required")
    private String userId;

    @NotBlank(message = "stage_id is required")
    private String stageId;

    @NotNull
    private Map<String, String> answers = new HashMap<>();
}
