package com.github.salilvnair.vllmadapter.llm.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call constrained decoding override. At most one of {@code choice}, {@code grammar},
 * {@code json} and {@code regex} is honoured; see
 * {@link com.github.salilvnair.vllmadapter.llm.parameter.DecodingParameterResolver}.
 *
 * <p>{@code json} accepts either a schema serialized as a string or a structured value
 * (map, {@link com.fasterxml.jackson.databind.JsonNode}, POJO). Keys outside the known set are kept
 * in {@link #getUnsupported()} so they can be reported by name.</p>
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GuidedDecoding {

    private List<String> choice;
    private String grammar;
    private Object json;
    private String regex;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> unsupported;

    @Builder
    public GuidedDecoding(List<String> choice, String grammar, Object json, String regex) {
        this.choice = choice;
        this.grammar = grammar;
        this.json = json;
        this.regex = regex;
    }

    @JsonAnyGetter
    public Map<String, Object> getUnsupported() {
        return unsupported == null ? Collections.emptyMap() : Collections.unmodifiableMap(unsupported);
    }

    @JsonAnySetter
    public void putUnsupported(String key, Object value) {
        if (unsupported == null) {
            unsupported = new LinkedHashMap<>();
        }
        unsupported.put(key, value);
    }

    /** Names of every key that carries a value, known keys first. */
    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        if (choice != null) keys.add("choice");
        if (grammar != null) keys.add("grammar");
        if (json != null) keys.add("json");
        if (regex != null) keys.add("regex");
        keys.addAll(getUnsupported().keySet());
        return keys;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return keys().isEmpty();
    }
}
