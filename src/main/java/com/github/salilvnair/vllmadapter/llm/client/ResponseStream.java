package com.github.salilvnair.vllmadapter.llm.client;

import java.util.Iterator;

/**
 * Blocking iterator over a server-streamed response. {@link #close()} cancels the call if it is
 * still running and is safe to call more than once.
 */
public interface ResponseStream<T> extends Iterator<T>, AutoCloseable {

    @Override
    void close();
}
