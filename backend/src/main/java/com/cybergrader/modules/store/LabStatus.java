package com.cybergrader.modules.store;

import com.cybergrader.modules.content.FlagValidatorKind;

import java.util.List;

/** A lab as one user sees it: its prompts plus how many flags they have captured. */
public record LabStatus(String id,
                        String title,
                        String version,
                        String instructions,
                        int score,
                        int totalFlags,
                        List<LabFlagPrompt> flags) {

    public record LabFlagPrompt(String name, String prompt, FlagValidatorKind validator, String pattern) {}
}
