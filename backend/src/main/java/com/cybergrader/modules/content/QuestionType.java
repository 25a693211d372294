package com.cybergrader.modules.content;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QuestionType {
    @JsonProperty("multiple_choice")
    MULTIPLE_CHOICE,
    @JsonProperty("short_answer")
    SHORT_ANSWER
}
