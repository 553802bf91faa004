package com.github.salilvnair.vllmadapter.llm.core;

import com.github.salilvnair.vllmadapter.exception.LlmCancelledException;
import com.github.salilvnair.vllmadapter.exception.LlmErrorClassifier;
import com.github.salilvnair.vllmadapter.exception.LlmValidationException;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedGenerationRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedGenerationResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedTokenizeRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedTokenizeResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.GenerationRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.GenerationResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.ModelInfoRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.ModelInfoResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.Parameters;
import com.github.salilvnair.vllmadapter.grpc.fmaas.SingleGenerationRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.TokenizeRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.TokenizeResponse;
import com.github.salilvnair.vllmadapter.llm.client.GenerationServiceClient;
import com.github.salilvnair.vllmadapter.llm.client.ResponseStream;
import com.github.salilvnair.vllmadapter.llm.context.CancellationSignal;
import com.github.salilvnair.vllmadapter.llm.model.ExecutionOptions;
import com.github.salilvnair.vllmadapter.llm.model.GenerateOptions;
import com.github.salilvnair.vllmadapter.llm.model.LlmMeta;
import com.github.salilvnair.vllmadapter.llm.model.TokenizeOutput;
import com.github.salilvnair.vllmadapter.llm.model.VllmOutput;
import com.github.salilvnair.vllmadapter.llm.parameter.DecodingParameterResolver;
import com.github.salilvnair.vllmadapter.snapshot.Snapshottable;
import com.github.salilvnair.vllmadapter.snapshot.VllmModelSnapshot;
import com.github.salilvnair.vllmadapter.util.JsonUtil;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link LanguageModel} backed by the TGIS/vLLM {@code fmaas.GenerationService}.
 *
 * Operations:
 *
 *  meta()      model info; exposes the maximum sequence length as token limit.
 *  tokenize()  single-item batched tokenize request.
 *  generate()  single-item batched generate request, or the folded stream
 *              when {@link GenerateOptions#isStream()} is set.
 *  stream()    server-streamed generation, one {@link VllmOutput} per non-empty chunk.
 *
 * Every remote failure leaves through {@link LlmErrorClassifier}. The instance keeps no per-call
 * state, so concurrent calls are safe; {@link #loadSnapshot} is not meant to race with them.
 */
@Slf4j
@Getter
public class VllmLanguageModel implements LanguageModel<VllmOutput>, Snapshottable<VllmModelSnapshot> {

    private String modelId;
    private Parameters parameters;
    private ExecutionOptions executionOptions;
    private GenerationServiceClient client;

    @Getter(AccessLevel.NONE)
    private final Supplier<GenerationServiceClient> clientProvider;
    @Getter(AccessLevel.NONE)
    private final DecodingParameterResolver parameterResolver;
    @Getter(AccessLevel.NONE)
    private final LlmErrorClassifier errorClassifier;

    @Builder
    public VllmLanguageModel(String modelId,
                             Parameters parameters,
                             ExecutionOptions executionOptions,
                             GenerationServiceClient client,
                             Supplier<GenerationServiceClient> clientProvider,
                             DecodingParameterResolver parameterResolver,
                             LlmErrorClassifier errorClassifier) {
        if (client == null && clientProvider == null) {
            throw new IllegalArgumentException("Either client or clientProvider must be provided");
        }
        this.modelId = modelId;
        this.parameters = parameters == null ? Parameters.getDefaultInstance() : parameters;
        this.executionOptions = executionOptions == null ? ExecutionOptions.defaults() : executionOptions;
        this.clientProvider = clientProvider;
        this.client = client != null ? client : clientProvider.get();
        this.parameterResolver = parameterResolver == null ? new DecodingParameterResolver() : parameterResolver;
        this.errorClassifier = errorClassifier == null ? new LlmErrorClassifier() : errorClassifier;
    }

    @Override
    public LlmMeta meta() {
        try {
            ModelInfoResponse response = client.modelInfo(ModelInfoRequest.newBuilder()
                    .setModelId(modelId)
                    .build());
            return new LlmMeta(Integer.toUnsignedLong(response.getMaxSequenceLength()));
        } catch (RuntimeException e) {
            throw errorClassifier.classify(e);
        }
    }

    @Override
    public TokenizeOutput tokenize(String input) {
        try {
            BatchedTokenizeResponse response = client.tokenize(BatchedTokenizeRequest.newBuilder()
                    .setModelId(modelId)
                    .addRequests(TokenizeRequest.newBuilder().setText(input))
                    .setReturnTokens(true)
                    .build());
            if (response.getResponsesCount() == 0) {
                throw LlmValidationException.missingOutput();
            }
            TokenizeResponse output = response.getResponses(0);
            return new TokenizeOutput(List.copyOf(output.getTokensList()), Integer.toUnsignedLong(output.getTokenCount()));
        } catch (RuntimeException e) {
            throw errorClassifier.classify(e);
        }
    }

    @Override
    public VllmOutput generate(String input, GenerateOptions options) {
        GenerateOptions effective = options == null ? GenerateOptions.none() : options;
        if (effective.isStream()) {
            return generateFromStream(input, effective);
        }
        try {
            BatchedGenerationRequest request = BatchedGenerationRequest.newBuilder()
                    .setModelId(modelId)
                    .addRequests(GenerationRequest.newBuilder().setText(input))
                    .setParams(parameterResolver.resolve(parameters, effective.getGuided()))
                    .build();
            log.debug("[VllmLanguageModel:{}] → generate input-length={}", modelId, input.length());

            BatchedGenerationResponse response = client.generate(request, effective.getSignal());
            if (response.getResponsesCount() == 0) {
                throw LlmValidationException.missingOutput();
            }
            return toOutput(response.getResponses(0));
        } catch (RuntimeException e) {
            throw errorClassifier.classify(e);
        }
    }

    /**
     * Lazy, single-use stream of generated chunks. Close it (try-with-resources) when abandoning
     * it early so the server-side call is cancelled.
     */
    @Override
    public Stream<VllmOutput> stream(String input, GenerateOptions options) {
        GenerateOptions effective = options == null ? GenerateOptions.none() : options;
        try {
            SingleGenerationRequest request = SingleGenerationRequest.newBuilder()
                    .setModelId(modelId)
                    .setRequest(GenerationRequest.newBuilder().setText(input))
                    .setParams(parameterResolver.resolve(parameters, effective.getGuided()))
                    .build();
            log.debug("[VllmLanguageModel:{}] → generateStream input-length={}", modelId, input.length());

            ResponseStream<GenerationResponse> responses = client.generateStream(request, effective.getSignal());
            Iterator<VllmOutput> chunks = new ChunkIterator(responses, effective.getSignal());
            return StreamSupport.stream(
                            Spliterators.spliteratorUnknownSize(chunks, Spliterator.ORDERED | Spliterator.NONNULL),
                            false)
                    .onClose(responses::close);
        } catch (RuntimeException e) {
            throw errorClassifier.classify(e);
        }
    }

    @Override
    public VllmModelSnapshot createSnapshot() {
        return new VllmModelSnapshot(modelId, JsonUtil.protoToMap(parameters), executionOptions);
    }

    @Override
    public void loadSnapshot(VllmModelSnapshot snapshot) {
        this.modelId = snapshot.modelId();
        this.parameters = JsonUtil.mapToProto(snapshot.parameters(), Parameters.newBuilder()).build();
        this.executionOptions = snapshot.executionOptions() == null
                ? ExecutionOptions.defaults()
                : snapshot.executionOptions();
        // the client is a live connection and never part of the snapshot
        this.client = Objects.requireNonNull(
                clientProvider == null ? client : clientProvider.get(),
                "clientProvider returned no client");
    }

    private VllmOutput generateFromStream(String input, GenerateOptions options) {
        try (Stream<VllmOutput> chunks = stream(input, options)) {
            VllmOutput result = VllmOutput.empty();
            Iterator<VllmOutput> iterator = chunks.iterator();
            while (iterator.hasNext()) {
                result.merge(iterator.next());
            }
            return result;
        }
    }

    private static VllmOutput toOutput(GenerationResponse response) {
        return new VllmOutput(response.getText(), JsonUtil.protoToMap(response.toBuilder().clearText()));
    }

    /**
     * Drops chunks with empty text; the server can emit them while its repetition checker
     * holds tokens back.
     */
    private final class ChunkIterator implements Iterator<VllmOutput> {

        private final ResponseStream<GenerationResponse> responses;
        private final CancellationSignal signal;
        private VllmOutput next;
        private boolean finished;

        private ChunkIterator(ResponseStream<GenerationResponse> responses, CancellationSignal signal) {
            this.responses = responses;
            this.signal = signal;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            try {
                while (true) {
                    if (signal != null && signal.isCancelled()) {
                        throw new LlmCancelledException("Generation stream cancelled");
                    }
                    if (!responses.hasNext()) {
                        finished = true;
                        responses.close();
                        return false;
                    }
                    GenerationResponse chunk = responses.next();
                    if (!chunk.getText().isEmpty()) {
                        next = toOutput(chunk);
                        return true;
                    }
                }
            } catch (RuntimeException e) {
                finished = true;
                responses.close();
                throw errorClassifier.classify(e);
            }
        }

        @Override
        public VllmOutput next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            VllmOutput current = next;
            next = null;
            return current;
        }
    }
}
