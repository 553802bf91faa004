package com.github.salilvnair.vllmadapter.exception;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Converts any failure raised at a remote-call boundary into the {@link LlmException} taxonomy.
 *
 * <ol>
 *   <li>{@link LlmException} is returned as is.</li>
 *   <li>gRPC status failures become {@link LlmCancelledException} for {@code CANCELLED},
 *       otherwise {@link LlmTransportException}, retryable only for
 *       {@code RESOURCE_EXHAUSTED}, {@code DEADLINE_EXCEEDED} and {@code UNAVAILABLE}.</li>
 *   <li>{@link CancellationException} becomes {@link LlmCancelledException}.</li>
 *   <li>Anything else is wrapped as {@link LlmErrorCode#LLM_CALL_FAILED}.</li>
 * </ol>
 *
 * Callers throw the returned exception; the classifier never throws itself.
 */
public class LlmErrorClassifier {

    private static final Set<Status.Code> RETRYABLE_CODES = EnumSet.of(
            Status.Code.RESOURCE_EXHAUSTED,
            Status.Code.DEADLINE_EXCEEDED,
            Status.Code.UNAVAILABLE
    );

    public LlmException classify(Throwable error) {
        if (error instanceof LlmException llmException) {
            return llmException;
        }
        if (error instanceof StatusRuntimeException statusError) {
            return fromStatus(statusError.getStatus(), statusError);
        }
        if (error instanceof StatusException statusError) {
            return fromStatus(statusError.getStatus(), statusError);
        }
        if (error instanceof CancellationException) {
            return new LlmCancelledException(error);
        }
        return new LlmException(LlmErrorCode.LLM_CALL_FAILED, error);
    }

    public boolean isRetryable(Status.Code code) {
        return RETRYABLE_CODES.contains(code);
    }

    private LlmException fromStatus(Status status, Throwable error) {
        if (status.getCode() == Status.Code.CANCELLED) {
            return new LlmCancelledException(error);
        }
        return new LlmTransportException(status.getCode(), isRetryable(status.getCode()), error);
    }
}
