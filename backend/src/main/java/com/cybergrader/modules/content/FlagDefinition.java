package com.cybergrader.modules.content;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One flag of a lab and the strategy used to check submissions against it.
 * {@code value} is the answer for {@link FlagValidatorKind#EXACT},
 * {@code pattern} the regular expression for {@link FlagValidatorKind#REGEX}.
 */
@Value
@Builder
@Jacksonized
public class FlagDefinition {

    @NotBlank(message = "flag name is required")
    String name;

    @NotNull(message = "flag prompt is required")
    String prompt;

    @NotNull(message = "flag validator is required")
    FlagValidatorKind validator;

    String value;

    String pattern;
}
