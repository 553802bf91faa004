package com.github.salilvnair.vllmadapter.snapshot;

import com.github.salilvnair.vllmadapter.llm.model.ExecutionOptions;

import java.util.Map;

/**
 * Persisted adapter state. {@code parameters} uses the proto JSON mapping of
 * {@code fmaas.Parameters}. The client handle is deliberately absent.
 */
public record VllmModelSnapshot(
        String modelId,
        Map<String, Object> parameters,
        ExecutionOptions executionOptions
) {}
