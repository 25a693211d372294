package com.cybergrader.exception;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ResourceNotFoundExceptionTest {

    @Test
    void messageIsLocaleIndependent() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            ResourceNotFoundException ex = new ResourceNotFoundException("INSTRUCTIONS", "L1");

            assertEquals("Unknown instructions: L1", ex.getMessage());
            assertEquals("INSTRUCTIONS", ex.getResource());
            assertEquals("L1", ex.getId());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
