package com.eainde.compatibility.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool that carries the submitting thread's MDC into each task.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads, String threadNamePrefix) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive, got " + threads);
        }
        this.delegate = Executors.newFixedThreadPool(threads, namedDaemonThreads(threadNamePrefix));
    }

    @Override
    public void execute(Runnable command) {
        delegate.execute(withContext(command, MDC.getCopyOfContextMap()));
    }

    /** Installs the submitter's MDC for the task's duration; pooled threads start and end clean. */
    private static Runnable withContext(Runnable command, Map<String, String> submitterMdc) {
        return () -> {
            if (submitterMdc == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(submitterMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        };
    }

    /** Stops accepting work and waits briefly for running tasks. */
    public void shutdown() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(10, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
