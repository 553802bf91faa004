package com.github.salilvnair.vllmadapter.llm.model;

import java.util.List;

public record TokenizeOutput(
        List<String> tokens,
        long tokensCount
) {}
