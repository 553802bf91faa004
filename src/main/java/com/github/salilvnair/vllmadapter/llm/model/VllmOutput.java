package com.github.salilvnair.vllmadapter.llm.model;

import com.github.salilvnair.vllmadapter.snapshot.VllmOutputSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generated text plus the remaining response fields of one unary response or one streamed chunk.
 * {@code meta} is an opaque bag keyed by proto field name (e.g. {@code stop_reason},
 * {@code generated_token_count}).
 */
public class VllmOutput extends LlmOutput<VllmOutput, VllmOutputSnapshot> {

    private String text;
    private Map<String, Object> meta;

    public VllmOutput(String text, Map<String, Object> meta) {
        this.text = text == null ? "" : text;
        this.meta = meta == null ? new LinkedHashMap<>() : new LinkedHashMap<>(meta);
    }

    public static VllmOutput empty() {
        return new VllmOutput("", Map.of());
    }

    public String getText() {
        return text;
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    @Override
    public void merge(VllmOutput other) {
        this.text += other.text;
        this.meta.putAll(other.meta);
    }

    @Override
    public String getTextContent() {
        return text;
    }

    @Override
    public VllmOutputSnapshot createSnapshot() {
        return new VllmOutputSnapshot(text, new LinkedHashMap<>(meta));
    }

    @Override
    public void loadSnapshot(VllmOutputSnapshot snapshot) {
        this.text = snapshot.text() == null ? "" : snapshot.text();
        this.meta = snapshot.meta() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(snapshot.meta());
    }
}
