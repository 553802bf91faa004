package com.github.salilvnair.vllmadapter.exception;

import io.grpc.Status;
import lombok.Getter;

/**
 * A failure reported by the gRPC layer with a status code other than {@code CANCELLED}.
 */
@Getter
public final class LlmTransportException extends LlmException {

    private final Status.Code statusCode;

    public LlmTransportException(Status.Code statusCode, boolean retryable, Throwable cause) {
        super(LlmErrorCode.LLM_TRANSPORT_FAILED, LlmErrorCode.LLM_TRANSPORT_FAILED.defaultMessage(), cause, retryable);
        this.statusCode = statusCode;
    }
}
