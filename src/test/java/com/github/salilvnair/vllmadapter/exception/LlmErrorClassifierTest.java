package com.github.salilvnair.vllmadapter.exception;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmErrorClassifierTest {

    private final LlmErrorClassifier classifier = new LlmErrorClassifier();

    @Test
    void adapterErrorsPassThroughUnchanged() {
        LlmValidationException error = LlmValidationException.missingOutput();

        assertSame(error, classifier.classify(error));
    }

    @Test
    void throttlingTimeoutAndUnavailableAreRetryable() {
        for (Status status : new Status[]{Status.RESOURCE_EXHAUSTED, Status.DEADLINE_EXCEEDED, Status.UNAVAILABLE}) {
            LlmException classified = classifier.classify(status.asRuntimeException());

            LlmTransportException transport = assertInstanceOf(LlmTransportException.class, classified);
            assertTrue(transport.isRetryable(), status.getCode().name());
            assertEquals(status.getCode(), transport.getStatusCode());
            assertEquals(LlmErrorCode.LLM_TRANSPORT_FAILED, transport.getErrorCode());
        }
    }

    @Test
    void invalidArgumentIsNotRetryable() {
        StatusRuntimeException cause = Status.INVALID_ARGUMENT.withDescription("bad prompt").asRuntimeException();

        LlmException classified = classifier.classify(cause);

        LlmTransportException transport = assertInstanceOf(LlmTransportException.class, classified);
        assertFalse(transport.isRetryable());
        assertSame(cause, transport.getCause());
    }

    @Test
    void checkedStatusExceptionIsClassifiedByCode() {
        StatusException cause = Status.UNAVAILABLE.asException();

        LlmTransportException transport = assertInstanceOf(LlmTransportException.class, classifier.classify(cause));

        assertTrue(transport.isRetryable());
    }

    @Test
    void cancelledStatusBecomesCancellation() {
        LlmException classified = classifier.classify(Status.CANCELLED.asRuntimeException());

        assertInstanceOf(LlmCancelledException.class, classified);
        assertEquals(LlmErrorCode.LLM_CANCELLED, classified.getErrorCode());
        assertFalse(classified.isRetryable());
    }

    @Test
    void cancellationExceptionBecomesCancellation() {
        assertInstanceOf(LlmCancelledException.class, classifier.classify(new CancellationException("stop")));
    }

    @Test
    void unknownFailureIsWrappedAsCallFailure() {
        IllegalStateException cause = new IllegalStateException("boom");

        LlmException classified = classifier.classify(cause);

        assertEquals(LlmException.class, classified.getClass());
        assertEquals(LlmErrorCode.LLM_CALL_FAILED, classified.getErrorCode());
        assertSame(cause, classified.getCause());
        assertFalse(classified.isRetryable());
    }
}
