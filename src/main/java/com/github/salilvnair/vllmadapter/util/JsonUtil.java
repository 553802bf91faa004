package com.github.salilvnair.vllmadapter.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;

@UtilityClass
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final ObjectReader STRICT_TREE_READER = MAPPER.readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final JsonFormat.Printer PROTO_PRINTER = JsonFormat.printer()
            .preservingProtoFieldNames()
            .omittingInsignificantWhitespace();

    private static final JsonFormat.Parser PROTO_PARSER = JsonFormat.parser();

    /** Strict parse; blank input and trailing content are syntax errors. */
    public static JsonNode parse(String json) throws JsonProcessingException {
        JsonNode node = STRICT_TREE_READER.readValue(json);
        if (node == null || node.isMissingNode()) {
            throw MismatchedInputException.from((JsonParser) null, JsonNode.class, "No JSON content");
        }
        return node;
    }

    /**
     * Convert any object into JSON string.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize object to JSON", e);
        }
    }

    /**
     * Parse JSON string into target type.
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to deserialize JSON", e);
        }
    }

    public static <T> T convert(Object value, Class<T> type) {
        return MAPPER.convertValue(value, type);
    }

    /**
     * Populated fields of a protobuf message keyed by their proto field names.
     * Fields left at their default value are not present.
     */
    public static Map<String, Object> protoToMap(MessageOrBuilder message) {
        try {
            return MAPPER.readValue(PROTO_PRINTER.print(message), MAP_TYPE);
        } catch (InvalidProtocolBufferException | JsonProcessingException e) {
            throw new IllegalStateException("Failed to convert " + message.getClass().getSimpleName() + " to map", e);
        }
    }

    /**
     * Merges a map shaped like the proto JSON mapping into the given builder.
     * Both proto field names and lowerCamelCase names are accepted.
     */
    public static <B extends Message.Builder> B mapToProto(Map<String, ?> values, B builder) {
        if (values == null || values.isEmpty()) {
            return builder;
        }
        try {
            PROTO_PARSER.merge(MAPPER.writeValueAsString(values), builder);
            return builder;
        } catch (InvalidProtocolBufferException | JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to convert map to " + builder.getDescriptorForType().getName(), e);
        }
    }
}
