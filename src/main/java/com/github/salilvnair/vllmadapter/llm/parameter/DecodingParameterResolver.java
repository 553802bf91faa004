package com.github.salilvnair.vllmadapter.llm.parameter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.salilvnair.vllmadapter.exception.LlmValidationException;
import com.github.salilvnair.vllmadapter.grpc.fmaas.DecodingParameters;
import com.github.salilvnair.vllmadapter.grpc.fmaas.Parameters;
import com.github.salilvnair.vllmadapter.llm.model.GuidedDecoding;
import com.github.salilvnair.vllmadapter.util.JsonUtil;

/**
 * Builds the {@link Parameters} sent with a generation request from the adapter's base
 * parameters and an optional per-call {@link GuidedDecoding} override.
 *
 * <p>A non-empty override replaces the base decoding parameters entirely and selects one guided mode,
 * first match wins: choice, grammar, json, regex. An empty override leaves the base decoding
 * parameters in place. Inputs are never modified.</p>
 */
public class DecodingParameterResolver {

    public Parameters resolve(Parameters base, GuidedDecoding override) {
        Parameters parameters = base == null ? Parameters.getDefaultInstance() : base;
        if (override == null || override.isEmpty()) {
            return parameters;
        }
        return parameters.toBuilder()
                .setDecoding(guidedDecoding(override))
                .build();
    }

    private DecodingParameters guidedDecoding(GuidedDecoding override) {
        DecodingParameters.Builder decoding = DecodingParameters.newBuilder();
        if (override.getChoice() != null) {
            decoding.setChoice(DecodingParameters.StringChoices.newBuilder()
                    .addAllChoices(override.getChoice()));
        } else if (hasText(override.getGrammar())) {
            decoding.setGrammar(override.getGrammar());
        } else if (hasJson(override.getJson())) {
            decoding.setJsonSchema(jsonSchema(override.getJson()));
        } else if (hasText(override.getRegex())) {
            decoding.setRegex(override.getRegex());
        } else {
            throw LlmValidationException.unsupportedConstraint(override.keys());
        }
        return decoding.build();
    }

    private String jsonSchema(Object json) {
        if (json instanceof String text) {
            try {
                return JsonUtil.toJson(JsonUtil.parse(text));
            } catch (JsonProcessingException e) {
                throw LlmValidationException.invalidJsonSchema(e);
            }
        }
        return JsonUtil.toJson(json);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static boolean hasJson(Object value) {
        return value != null && !(value instanceof String text && text.isEmpty());
    }
}
