package com.cybergrader.modules.content;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FlagValidatorKind {
    @JsonProperty("exact")
    EXACT,
    @JsonProperty("regex")
    REGEX,
    @JsonProperty("file_exists")
    FILE_EXISTS
}
