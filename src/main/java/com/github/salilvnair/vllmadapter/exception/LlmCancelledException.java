package com.github.salilvnair.vllmadapter.exception;

public final class LlmCancelledException extends LlmException {

    public LlmCancelledException(Throwable cause) {
        super(LlmErrorCode.LLM_CANCELLED, cause);
    }

    public LlmCancelledException(String message) {
        super(LlmErrorCode.LLM_CANCELLED, message);
    }
}
