package com.github.salilvnair.vllmadapter.llm.model;

import com.github.salilvnair.vllmadapter.snapshot.Snapshottable;

/**
 * Mergeable result of a generation call. Streamed chunks are folded into one instance with
 * {@link #merge(LlmOutput)} in arrival order.
 */
public abstract class LlmOutput<O extends LlmOutput<O, S>, S> implements Snapshottable<S> {

    public abstract void merge(O other);

    public abstract String getTextContent();

    @Override
    public String toString() {
        return getTextContent();
    }
}
