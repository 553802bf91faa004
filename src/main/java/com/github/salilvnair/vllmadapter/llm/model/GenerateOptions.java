package com.github.salilvnair.vllmadapter.llm.model;

import com.github.salilvnair.vllmadapter.llm.context.CancellationSignal;
import lombok.Builder;
import lombok.Getter;

/**
 * Per-call options. Exists only for the duration of one adapter operation.
 */
@Getter
@Builder(toBuilder = true)
public class GenerateOptions {

    private final GuidedDecoding guided;
    private final CancellationSignal signal;
    private final boolean stream;

    public static GenerateOptions none() {
        return GenerateOptions.builder().build();
    }
}
