package com.github.salilvnair.vllmadapter.llm.client;

import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedGenerationRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedGenerationResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedTokenizeRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.BatchedTokenizeResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.GenerationResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.ModelInfoRequest;
import com.github.salilvnair.vllmadapter.grpc.fmaas.ModelInfoResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.SingleGenerationRequest;
import com.github.salilvnair.vllmadapter.llm.context.CancellationSignal;

/**
 * Remote operations of the {@code fmaas.GenerationService}. Failures surface as
 * {@link io.grpc.StatusRuntimeException}; a cancelled {@link CancellationSignal} aborts the call
 * with status {@code CANCELLED}. A {@code null} signal means the call cannot be cancelled.
 */
public interface GenerationServiceClient {

    ModelInfoResponse modelInfo(ModelInfoRequest request);

    BatchedTokenizeResponse tokenize(BatchedTokenizeRequest request);

    BatchedGenerationResponse generate(BatchedGenerationRequest request, CancellationSignal signal);

    ResponseStream<GenerationResponse> generateStream(SingleGenerationRequest request, CancellationSignal signal);
}
