package com.github.salilvnair.vllmadapter.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.salilvnair.vllmadapter.grpc.fmaas.DecodingMethod;
import com.github.salilvnair.vllmadapter.grpc.fmaas.GenerationResponse;
import com.github.salilvnair.vllmadapter.grpc.fmaas.Parameters;
import com.github.salilvnair.vllmadapter.grpc.fmaas.StopReason;
import com.github.salilvnair.vllmadapter.grpc.fmaas.StoppingCriteria;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonUtilTest {

    @Test
    void parseRejectsMalformedJson() {
        assertThrows(JsonProcessingException.class, () -> JsonUtil.parse("{bad json"));
    }

    @Test
    void parseRejectsTrailingContent() {
        assertThrows(JsonProcessingException.class, () -> JsonUtil.parse("{\"a\":1} {\"b\":2}"));
    }

    @Test
    void parseRejectsBlankInput() {
        assertThrows(JsonProcessingException.class, () -> JsonUtil.parse("  \n "));
    }

    @Test
    void parseAcceptsSurroundingWhitespace() throws JsonProcessingException {
        assertEquals(1, JsonUtil.parse("  {\"a\":1}\n").get("a").asInt());
    }

    @Test
    void protoToMapKeepsOnlyPopulatedFieldsUnderProtoNames() {
        GenerationResponse response = GenerationResponse.newBuilder()
                .setGeneratedTokenCount(3)
                .setStopReason(StopReason.EOS_TOKEN)
                .build();

        Map<String, Object> map = JsonUtil.protoToMap(response);

        assertEquals(Map.of("generated_token_count", 3, "stop_reason", "EOS_TOKEN"), map);
        assertFalse(map.containsKey("text"));
        assertFalse(map.containsKey("seed"));
    }

    @Test
    void mapToProtoAcceptsProtoFieldNames() {
        Parameters parameters = JsonUtil.mapToProto(
                Map.of("method", "SAMPLE", "stopping", Map.of("max_new_tokens", 200)),
                Parameters.newBuilder()).build();

        assertEquals(DecodingMethod.SAMPLE, parameters.getMethod());
        assertEquals(200, parameters.getStopping().getMaxNewTokens());
    }

    @Test
    void mapToProtoLeavesBuilderUntouchedForEmptyMap() {
        Parameters.Builder builder = Parameters.newBuilder()
                .setStopping(StoppingCriteria.newBuilder().setMaxNewTokens(5));

        assertSame(builder, JsonUtil.mapToProto(Map.of(), builder));
        assertEquals(5, builder.getStopping().getMaxNewTokens());
    }

    @Test
    void mapToProtoRejectsUnknownFields() {
        assertThrows(IllegalArgumentException.class,
                () -> JsonUtil.mapToProto(Map.of("no_such_field", 1), Parameters.newBuilder()));
    }

    @Test
    void parametersSurviveMapRoundTrip() {
        Parameters original = Parameters.newBuilder()
                .setMethod(DecodingMethod.GREEDY)
                .setTruncateInputTokens(512)
                .setStopping(StoppingCriteria.newBuilder().setMaxNewTokens(100).addStopSequences("\n\n"))
                .build();

        assertEquals(original, JsonUtil.mapToProto(JsonUtil.protoToMap(original), Parameters.newBuilder()).build());
    }
}
