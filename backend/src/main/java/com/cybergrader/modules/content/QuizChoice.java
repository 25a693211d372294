package com.cybergrader.modules.content;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class QuizChoice {

    @NotBlank(message = "choice key is required")
    String key;

    String label;
}
