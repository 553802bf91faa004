package com.github.salilvnair.vllmadapter.llm.core;

import com.github.salilvnair.vllmadapter.llm.model.GenerateOptions;
import com.github.salilvnair.vllmadapter.llm.model.LlmMeta;
import com.github.salilvnair.vllmadapter.llm.model.LlmOutput;
import com.github.salilvnair.vllmadapter.llm.model.TokenizeOutput;

import java.util.stream.Stream;

public interface LanguageModel<O extends LlmOutput<O, ?>> {
    String getModelId();
    LlmMeta meta();
    TokenizeOutput tokenize(String input);
    O generate(String input, GenerateOptions options);
    Stream<O> stream(String input, GenerateOptions options);
    default O generate(String input) {
        return generate(input, GenerateOptions.none());
    }
}
