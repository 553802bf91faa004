package com.github.salilvnair.vllmadapter.snapshot;

/**
 * State that can be captured and restored, excluding live resource handles.
 *
 * @param <S> snapshot type, serializable with Jackson
 */
public interface Snapshottable<S> {

    S createSnapshot();

    void loadSnapshot(S snapshot);
}
