package com.cybergrader.modules.content;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ExamStageDefinition {

    @NotBlank(message = "stage id is required")
    String id;

    @NotBlank(message = "stage title is required")
    String title;

    @Builder.Default
    String description = "";

    @JsonProperty("max_score")
    @Min(value = 0, message = "stage max_score must not be negative")
    @Builder.Default
    int maxScore = 10;
}
