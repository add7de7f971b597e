package com.project.provenance.core;

import java.nio.charset.StandardCharsets;

/**
 * Input shape checks for ledger calls.
 *
 * These mirror the field types of the registry: bounded strings, non-negative
 * prices and non-null principals. They run before any gate and never touch
 * ledger state.
 */
public final class InputValidator {

    public static final int MODEL_ID_MAX_BYTES = 64;
    public static final int MODEL_NAME_MAX_BYTES = 128;
    public static final int MODEL_VERSION_MAX_BYTES = 32;
    public static final int VERIFICATION_HASH_MAX_BYTES = 64;

    private InputValidator() {}

    /**
     * Validate an AI model identifier.
     *
     * @param modelId The model id to validate
     * @throws InvalidInputException if validation fails
     */
    public static void validateModelId(String modelId) {
        if (modelId == null) {
            throw new InvalidInputException("Model ID must not be null");
        }
        if (modelId.isBlank()) {
            throw new InvalidInputException("Model ID must not be blank");
        }
        validateMaxBytes(modelId, MODEL_ID_MAX_BYTES, "Model ID");
    }

    /**
     * Validate a model id that refers to a model rather than naming a new one.
     * Blank ids are well-formed here; they simply match no registered model.
     */
    public static void validateModelReference(String modelId) {
        validateMaxBytes(modelId, MODEL_ID_MAX_BYTES, "Model ID");
    }

    public static void validateModelName(String name) {
        validateMaxBytes(name, MODEL_NAME_MAX_BYTES, "Model name");
    }

    public static void validateModelVersion(String version) {
        validateMaxBytes(version, MODEL_VERSION_MAX_BYTES, "Model version");
    }

    /**
     * Validate a caller-supplied verification hash. Content is opaque; only
     * the length is bounded.
     */
    public static void validateVerificationHash(String hash) {
        validateMaxBytes(hash, VERIFICATION_HASH_MAX_BYTES, "Verification hash");
    }

    /**
     * Validate string fits in the given number of UTF-8 bytes.
     *
     * @param value The string to validate
     * @param maxBytes Maximum encoded length (inclusive)
     * @param fieldName Name of the field for error messages
     * @throws InvalidInputException if validation fails
     */
    public static void validateMaxBytes(String value, int maxBytes, String fieldName) {
        if (value == null) {
            throw new InvalidInputException(fieldName + " must not be null");
        }
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        if (length > maxBytes) {
            throw new InvalidInputException(
                String.format("%s must be at most %d bytes: length %d exceeds maximum",
                    fieldName, maxBytes, length)
            );
        }
    }

    /**
     * Validate non-negative integer.
     *
     * @param value The value to validate
     * @param fieldName Name of the field for error messages
     * @throws InvalidInputException if validation fails
     */
    public static void validateNonNegative(long value, String fieldName) {
        if (value < 0) {
            throw new InvalidInputException(
                String.format("%s must not be negative: got %d", fieldName, value)
            );
        }
    }

    public static <T> T requireNonNull(T value, String fieldName) {
        if (value == null) {
            throw new InvalidInputException(fieldName + " must not be null");
        }
        return value;
    }

    /**
     * Exception thrown when input validation fails.
     */
    public static class InvalidInputException extends IllegalArgumentException {
        public InvalidInputException(String message) {
            super(message);
        }

        public InvalidInputException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
