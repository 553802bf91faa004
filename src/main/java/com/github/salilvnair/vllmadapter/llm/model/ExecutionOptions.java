package com.github.salilvnair.vllmadapter.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Options consumed by whoever drives the model (retry loops, schedulers). Carried and persisted
 * with the adapter state, not interpreted by it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionOptions(
        Integer maxRetries
) {

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(null);
    }
}
