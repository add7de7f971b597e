package com.project.provenance.core;

import com.project.provenance.core.InputValidator.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputValidatorTest {

    @Test
    @DisplayName("Model id must be present and fit in 64 bytes")
    void modelId() {
        assertThrows(InvalidInputException.class, () -> InputValidator.validateModelId(null));
        assertThrows(InvalidInputException.class, () -> InputValidator.validateModelId("  "));
        assertThrows(InvalidInputException.class, () -> InputValidator.validateModelId("a".repeat(65)));
        assertDoesNotThrow(() -> InputValidator.validateModelId("a".repeat(64)));
    }

    @Test
    @DisplayName("Length limits count UTF-8 bytes, not characters")
    void byteLength() {
        // 22 three-byte characters = 66 bytes
        String wide = "€".repeat(22);
        assertEquals(22, wide.length());
        assertThrows(InvalidInputException.class, () -> InputValidator.validateVerificationHash(wide));
        assertDoesNotThrow(() -> InputValidator.validateVerificationHash("€".repeat(21)));
    }

    @Test
    @DisplayName("Empty hash, name and version are allowed")
    void emptyStrings() {
        assertDoesNotThrow(() -> InputValidator.validateVerificationHash(""));
        assertDoesNotThrow(() -> InputValidator.validateModelName(""));
        assertDoesNotThrow(() -> InputValidator.validateModelVersion(""));
        assertThrows(InvalidInputException.class, () -> InputValidator.validateModelName(null));
    }

    @Test
    void nonNegative() {
        assertDoesNotThrow(() -> InputValidator.validateNonNegative(0, "Price"));
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> InputValidator.validateNonNegative(-3, "Price"));
        assertTrue(e.getMessage().contains("Price"));
    }
}
