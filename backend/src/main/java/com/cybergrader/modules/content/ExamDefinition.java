package com.cybergrader.modules.content;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExamDefinition {

    @NotBlank(message = "exam id is required")
    String id;

    @NotBlank(message = "exam title is required")
    String title;

    String version;

    @NotNull(message = "exam stages must be a list")
    @Builder.Default
    List<@Valid @NotNull ExamStageDefinition> stages = List.of();

    public Optional<ExamStageDefinition> findStage(String stageId) {
        return stages.stream().filter(stage -> stage.getId().equals(stageId)).findFirst();
    }
}
