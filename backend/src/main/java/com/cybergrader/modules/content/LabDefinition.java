package com.cybergrader.modules.content;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
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
public class LabDefinition {

    @NotBlank(message = "lab id is required")
    String id;

    @NotBlank(message = "lab title is required")
    String title;

    String version;

    /** Path of the markdown instructions, relative to the content root. */
    @JsonProperty("instructions_path")
    @JsonAlias("instructions")
    @Builder.Default
    String instructionsPath = "";

    @NotNull(message = "lab flags must be a list")
    @Builder.Default
    List<@Valid @NotNull FlagDefinition> flags = List.of();

    public Optional<FlagDefinition> findFlag(String flagName) {
        return flags.stream().filter(flag -> flag.getName().equals(flagName)).findFirst();
    }
}
