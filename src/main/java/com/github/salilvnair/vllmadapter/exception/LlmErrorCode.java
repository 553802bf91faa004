package com.github.salilvnair.vllmadapter.exception;

public enum LlmErrorCode {

    // =========================
    // Remote call errors
    // =========================
    LLM_CALL_FAILED(
            "LLM has occurred an error!",
            false
    ),

    LLM_TRANSPORT_FAILED(
            "LLM has occurred an error!",
            false
    ),

    LLM_CANCELLED(
            "LLM call was cancelled",
            false
    ),

    // =========================
    // Local validation errors
    // =========================
    LLM_MISSING_OUTPUT(
            "Missing output",
            false
    ),

    LLM_UNSUPPORTED_CONSTRAINT(
            "Constraint decoding type is not supported",
            false
    ),

    LLM_INVALID_JSON_SCHEMA(
            "Guided JSON schema is not valid JSON",
            false
    ),

    // =========================
    // Snapshot errors
    // =========================
    SNAPSHOT_TYPE_UNKNOWN(
            "No snapshot factory registered for type",
            false
    ),

    SNAPSHOT_SERIALIZATION_FAILED(
            "Failed to serialize or deserialize snapshot",
            false
    );

    private final String defaultMessage;
    private final boolean retryable;

    LlmErrorCode(String defaultMessage, boolean retryable) {
        this.defaultMessage = defaultMessage;
        this.retryable = retryable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean retryable() {
        return retryable;
    }
}
