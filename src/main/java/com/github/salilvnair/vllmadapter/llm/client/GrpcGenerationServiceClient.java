package com.github.salilvnair.vllmadapter.llm.client;

import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedGenerationRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedGenerationResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedTokenizeRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedTokenizeResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.GenerationResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.GenerationServiceGrpc;
import com.github.salilvnair.vllmadapter.grpc.fmaas.ModelInfoRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.ModelInfoResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.SingleGenerationRequest;
import com.github.salilvnair.vllmadapter.llm.context.CancellationSignal;
import io.grpc.Channel;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link GenerationServiceClient} over a gRPC channel using the generated blocking stub.
 *
 * <p>Each cancellable call runs in its own {@link Context.CancellableContext}; cancelling the
 * {@link CancellationSignal} cancels that context, which aborts the call with status
 * {@code CANCELLED}. A streaming call keeps its context until the stream is closed.</p>
 */
@Slf4j
public class GrpcGenerationServiceClient implements GenerationServiceClient, AutoCloseable {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Channel channel;
    private final GenerationServiceGrpc.GenerationServiceBlockingStub stub;

    public GrpcGenerationServiceClient(Channel channel) {
        this.channel = channel;
        this.stub = GenerationServiceGrpc.newBlockingStub(channel);
    }

    @Override
    public ModelInfoResponse modelInfo(ModelInfoRequest request) {
        return stub.modelInfo(request);
    }

    @Override
    public BatchedTokenizeResponse tokenize(BatchedTokenizeRequest request) {
        return stub.tokenize(request);
    }

    @Override
    public BatchedGenerationResponse generate(BatchedGenerationRequest request, CancellationSignal signal) {
        if (signal == null) {
            return stub.generate(request);
        }
        Context.CancellableContext context = Context.current().withCancellation();
        CancellationSignal.Registration registration = signal.onCancel(() -> cancel(context));
        try {
            return runAttached(context, () -> stub.generate(request));
        } finally {
            registration.remove();
            context.cancel(null);
        }
    }

    @Override
    public ResponseStream<GenerationResponse> generateStream(SingleGenerationRequest request, CancellationSignal signal) {
        Context.CancellableContext context = Context.current().withCancellation();
        CancellationSignal.Registration registration = signal == null
                ? () -> { }
                : signal.onCancel(() -> cancel(context));
        try {
            Iterator<GenerationResponse> responses = runAttached(context, () -> stub.generateStream(request));
            return new ContextBoundResponseStream(responses, context, registration);
        } catch (RuntimeException e) {
            registration.remove();
            context.cancel(null);
            throw e;
        }
    }

    @Override
    public void close() {
        if (channel instanceof ManagedChannel managedChannel) {
            managedChannel.shutdown();
            try {
                if (!managedChannel.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    managedChannel.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                managedChannel.shutdownNow();
            }
        }
    }

    private static <T> T runAttached(Context.CancellableContext context, Supplier<T> call) {
        Context previous = context.attach();
        try {
            return call.get();
        } finally {
            context.detach(previous);
        }
    }

    private static void cancel(Context.CancellableContext context) {
        log.debug("[GrpcGenerationServiceClient] cancellation requested, cancelling call context");
        context.cancel(new CancellationException("Generation cancelled by caller"));
    }

    private static final class ContextBoundResponseStream implements ResponseStream<GenerationResponse> {

        private final Iterator<GenerationResponse> delegate;
        private final Context.CancellableContext context;
        private final CancellationSignal.Registration registration;

        private ContextBoundResponseStream(Iterator<GenerationResponse> delegate,
                                           Context.CancellableContext context,
                                           CancellationSignal.Registration registration) {
            this.delegate = delegate;
            this.context = context;
            this.registration = registration;
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public GenerationResponse next() {
            return delegate.next();
        }

        @Override
        public void close() {
            registration.remove();
            context.cancel(null);
        }
    }
}
