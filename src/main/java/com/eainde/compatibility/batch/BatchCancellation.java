package com.eainde.compatibility.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a running batch. Slots that have not started when
 * the flag flips are skipped; slots already running finish normally.
 */
public final class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static BatchCancellation none() {
        return new BatchCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
