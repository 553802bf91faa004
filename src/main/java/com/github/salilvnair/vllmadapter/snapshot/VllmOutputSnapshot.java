package com.github.salilvnair.vllmadapter.snapshot;

import java.util.Map;

public record VllmOutputSnapshot(
        String text,
        Map<String, Object> meta
) {}
