package com.cybergrader.exception;

import lombok.Getter;

import java.util.List;

/**
 * A content definition file could not be turned into a valid definition.
 * Raised during a sync; the sync is abandoned and nothing is applied.
 */
@Getter
public class ContentValidationException extends BusinessException {

    private final String file;
    private final List<String> violations;

    public ContentValidationException(String file, List<String> violations) {
        super("Invalid content in " + file + ": " + String.join("; ", violations));
        this.file = file;
        this.violations = List.copyOf(violations);
    }

    public ContentValidationException(String file, String violation, Throwable cause) {
        super("Invalid content in " + file + ": " + violation, cause);
        this.file = file;
        this.violations = List.of(violation);
    }
}
