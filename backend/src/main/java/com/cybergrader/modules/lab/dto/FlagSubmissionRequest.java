package com.cybergrader.modules.lab.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class FlagSubmissionRequest {

    @NotBlank(message = "user_id is required")
    private String userId;

    @NotNull(message = "submission is required")
    private String submission;
}
