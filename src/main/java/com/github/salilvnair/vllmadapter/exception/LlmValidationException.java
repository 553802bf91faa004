package com.github.salilvnair.vllmadapter.exception;

import lombok.Getter;

import java.util.List;

/**
 * Local protocol-shape failure. Raised before or after a remote call, never by the remote service.
 */
@Getter
public final class LlmValidationException extends LlmException {

    public enum Kind {
        MISSING_OUTPUT(LlmErrorCode.LLM_MISSING_OUTPUT),
        UNSUPPORTED_CONSTRAINT(LlmErrorCode.LLM_UNSUPPORTED_CONSTRAINT),
        INVALID_JSON_SCHEMA(LlmErrorCode.LLM_INVALID_JSON_SCHEMA);

        private final LlmErrorCode code;

        Kind(LlmErrorCode code) {
            this.code = code;
        }

        public LlmErrorCode code() {
            return code;
        }
    }

    private final Kind kind;
    private final List<String> unsupportedKeys;

    private LlmValidationException(Kind kind, String message, Throwable cause, List<String> unsupportedKeys) {
        super(kind.code(), message, cause);
        this.kind = kind;
        this.unsupportedKeys = unsupportedKeys;
    }

    public static LlmValidationException missingOutput() {
        return new LlmValidationException(Kind.MISSING_OUTPUT,
                LlmErrorCode.LLM_MISSING_OUTPUT.defaultMessage(), null, List.of());
    }

    public static LlmValidationException unsupportedConstraint(List<String> keys) {
        return new LlmValidationException(Kind.UNSUPPORTED_CONSTRAINT,
                "Following types %s for the constraint decoding are not supported!".formatted(String.join(",", keys)),
                null, List.copyOf(keys));
    }

    public static LlmValidationException invalidJsonSchema(Throwable cause) {
        return new LlmValidationException(Kind.INVALID_JSON_SCHEMA,
                LlmErrorCode.LLM_INVALID_JSON_SCHEMA.defaultMessage() + ": " + cause.getMessage(), cause, List.of());
    }
}
