package com.github.salilvnair.vllmadapter.snapshot;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "snapshot"})
public record SnapshotEnvelope(
        String type,
        Object snapshot
) {}
