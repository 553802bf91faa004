package com.github.salilvnair.vllmadapter.llm.model;

import com.github.salilvnair.vllmadapter.snapshot.VllmOutputSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.salilvnair.vllmadapter.support.TestConstants.GENERATED_TOKEN_COUNT;
import static com.github.salilvnair.vllmadapter.support.TestConstants.STOP_REASON;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

class VllmOutputTest {

    @Test
    void mergeConcatenatesTextAndOverlaysMeta() {
        VllmOutput result = VllmOutput.empty();
        result.merge(new VllmOutput("Hel", Map.of(GENERATED_TOKEN_COUNT, 1, STOP_REASON, "NOT_FINISHED")));
        result.merge(new VllmOutput("lo", Map.of(GENERATED_TOKEN_COUNT, 2, STOP_REASON, "EOS_TOKEN")));

        assertEquals("Hello", result.getText());
        assertEquals(Map.of(GENERATED_TOKEN_COUNT, 2, STOP_REASON, "EOS_TOKEN"), result.getMeta());
        assertEquals("Hello", result.toString());
    }

    @Test
    void snapshotIsDetachedFromLiveOutput() {
        VllmOutput output = new VllmOutput("abc", Map.of(STOP_REASON, "MAX_TOKENS"));

        VllmOutputSnapshot snapshot = output.createSnapshot();
        output.merge(new VllmOutput("def", Map.of(STOP_REASON, "EOS_TOKEN")));

        assertEquals("abc", snapshot.text());
        assertEquals("MAX_TOKENS", snapshot.meta().get(STOP_REASON));
    }

    @Test
    void loadSnapshotRestoresTextAndMeta() {
        VllmOutputSnapshot snapshot = new VllmOutputSnapshot("restored", Map.of(GENERATED_TOKEN_COUNT, 7));
        VllmOutput output = VllmOutput.empty();

        output.loadSnapshot(snapshot);

        assertEquals("restored", output.getTextContent());
        assertEquals(Map.of(GENERATED_TOKEN_COUNT, 7), output.getMeta());
        assertNotSame(snapshot.meta(), output.getMeta());
    }
}
