package com.github.salilvnair.vllmadapter.snapshot;

import com.github.salilvnair.vllmadapter.exception.LlmErrorCode;
import com.github.salilvnair.vllmadapter.exception.LlmException;
import com.github.salilvnair.vllmadapter.grpc.fmaas.DecodingMethod;
import com.github.salilvnair.vllmadapter.grpc.fmaas.DecodingParameters;
import com.github.salilvnair.vllmadapter.grpc.fmaas.Parameters;
import com.github.salilvnair.vllmadapter.grpc.fmaas.SamplingParameters;
import com.github.salilvnair.vllmadapter.grpc.fmaas.StoppingCriteria;
import com.github.salilvnair.vllmadapter.llm.client.GenerationServiceClient;
import com.github.salilvnair.vllmadapter.llm.core.VllmLanguageModel;
import com.github.salilvnair.vllmadapter.llm.model.ExecutionOptions;
import com.github.salilvnair.vllmadapter.llm.model.VllmOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static com.github.salilvnair.vllmadapter.support.TestConstants.MODEL_ID;
import static com.github.salilvnair.vllmadapter.support.TestConstants.STOP_REASON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class SnapshotRegistryTest {

    @Mock
    private GenerationServiceClient originalClient;

    @Mock
    private GenerationServiceClient restoredClient;

    private SnapshotRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SnapshotRegistry()
                .register("VllmOutput", VllmOutput.class, VllmOutputSnapshot.class, VllmOutput::empty)
                .register("VllmLanguageModel", VllmLanguageModel.class, VllmModelSnapshot.class,
                        () -> VllmLanguageModel.builder().clientProvider(() -> restoredClient).build());
    }

    @Test
    void modelRestoresConfigurationWithFreshClient() {
        Parameters parameters = Parameters.newBuilder()
                .setMethod(DecodingMethod.SAMPLE)
                .setSampling(SamplingParameters.newBuilder().setTemperature(0.5f).setSeed(42))
                .setStopping(StoppingCriteria.newBuilder().setMaxNewTokens(200).addStopSequences("END"))
                .setDecoding(DecodingParameters.newBuilder().setRepetitionPenalty(1.5f))
                .build();
        VllmLanguageModel model = VllmLanguageModel.builder()
                .modelId(MODEL_ID)
                .parameters(parameters)
                .executionOptions(new ExecutionOptions(3))
                .client(originalClient)
                .build();

        String json = registry.serialize(model);
        VllmLanguageModel restored = registry.restore(json, VllmLanguageModel.class);

        assertNotSame(model, restored);
        assertEquals(MODEL_ID, restored.getModelId());
        assertEquals(parameters, restored.getParameters());
        assertEquals(new ExecutionOptions(3), restored.getExecutionOptions());
        assertSame(restoredClient, restored.getClient());
    }

    @Test
    void snapshotDoesNotCarryTheClient() {
        VllmLanguageModel model = VllmLanguageModel.builder().modelId(MODEL_ID).client(originalClient).build();

        String json = registry.serialize(model);

        assertTrue(json.startsWith("{\"type\":\"VllmLanguageModel\""), json);
        assertTrue(!json.contains("client"), json);
    }

    @Test
    void outputRoundTripsThroughEnvelope() {
        VllmOutput output = new VllmOutput("done", Map.of(STOP_REASON, "EOS_TOKEN"));

        VllmOutput restored = registry.restore(registry.serialize(output), VllmOutput.class);

        assertEquals("done", restored.getText());
        assertEquals(Map.of(STOP_REASON, "EOS_TOKEN"), restored.getMeta());
    }

    @Test
    void unknownTypeNameIsRejected() {
        LlmException error = assertThrows(LlmException.class,
                () -> registry.restore("{\"type\":\"Nope\",\"snapshot\":{}}"));

        assertEquals(LlmErrorCode.SNAPSHOT_TYPE_UNKNOWN, error.getErrorCode());
    }

    @Test
    void unregisteredTargetIsRejected() {
        LlmException error = assertThrows(LlmException.class,
                () -> new SnapshotRegistry().serialize(VllmOutput.empty()));

        assertEquals(LlmErrorCode.SNAPSHOT_TYPE_UNKNOWN, error.getErrorCode());
    }

    @Test
    void malformedEnvelopeIsRejected() {
        LlmException error = assertThrows(LlmException.class, () -> registry.restore("{not json"));

        assertEquals(LlmErrorCode.SNAPSHOT_SERIALIZATION_FAILED, error.getErrorCode());
    }

    @Test
    void restoreChecksExpectedType() {
        String json = registry.serialize(VllmOutput.empty());

        LlmException error = assertThrows(LlmException.class, () -> registry.restore(json, VllmLanguageModel.class));

        assertEquals(LlmErrorCode.SNAPSHOT_TYPE_UNKNOWN, error.getErrorCode());
    }
}
