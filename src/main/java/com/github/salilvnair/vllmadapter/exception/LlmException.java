package com.github.salilvnair.vllmadapter.exception;

import lombok.Getter;

/**
 * Root of the adapter's error taxonomy.
 *
 * <p>An instance of this class itself is either a framework error raised by the adapter or a
 * generic wrapped failure ({@link LlmErrorCode#LLM_CALL_FAILED}) with the original error as cause.
 * Transport, cancellation and local validation failures use the permitted subclasses.</p>
 */
@Getter
public sealed class LlmException extends RuntimeException
        permits LlmTransportException, LlmCancelledException, LlmValidationException {

    private final LlmErrorCode errorCode;
    private final boolean retryable;

    public LlmException(LlmErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code;
        this.retryable = code.retryable();
    }

    public LlmException(LlmErrorCode code, Throwable cause) {
        super(code.defaultMessage(), cause);
        this.errorCode = code;
        this.retryable = code.retryable();
    }

    public LlmException(LlmErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code;
        this.retryable = code.retryable();
    }

    protected LlmException(LlmErrorCode code, String overrideMessage, Throwable cause, boolean retryable) {
        super(overrideMessage, cause);
        this.errorCode = code;
        this.retryable = retryable;
    }
}
