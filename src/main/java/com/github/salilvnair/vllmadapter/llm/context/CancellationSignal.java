package com.github.salilvnair.vllmadapter.llm.context;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative, one-shot cancellation flag for a single adapter call.
 * Listeners registered after cancellation run immediately on the registering thread.
 */
public final class CancellationSignal {

    private final List<Runnable> listeners = new ArrayList<>();
    private boolean cancelled;

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public Registration onCancel(Runnable listener) {
        synchronized (this) {
            if (!cancelled) {
                listeners.add(listener);
                return () -> {
                    synchronized (this) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> { };
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }
}
