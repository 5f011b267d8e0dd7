package com.relayflow.relayflow_engine.executor;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag shared between the engine and a running node.
 * Executors either poll {@link #isCancelled()}, wait on {@link #await(Duration)} or
 * register a callback with {@link #onCancel(Runnable)} (e.g. to kill a subprocess).
 */
@Slf4j
public class CancelSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        latch.countDown();
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException ex) {
                log.warn("Cancel listener failed: {}", ex.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Blocks up to {@code timeout}; returns true if cancelled in the meantime. */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void onCancel(Runnable listener) {
        AtomicBoolean fired = new AtomicBoolean(false);
        Runnable once = () -> {
            if (fired.compareAndSet(false, true)) listener.run();
        };
        listeners.add(once);
        if (cancelled.get()) {
            once.run();
        }
    }

    /** New signal that fires when this one fires, but can also be cancelled on its own. */
    public CancelSignal child() {
        CancelSignal child = new CancelSignal();
        onCancel(child::cancel);
        return child;
    }
}
