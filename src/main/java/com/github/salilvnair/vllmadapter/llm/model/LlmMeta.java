package com.github.salilvnair.vllmadapter.llm.model;

/**
 * @param tokenLimit maximum sequence length reported by the server ({@code uint32} on the wire)
 */
public record LlmMeta(
        long tokenLimit
) {}
