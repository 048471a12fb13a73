package com.eainde.compatibility.oracle;

import dev.langchain4j.data.message.ChatMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Semaphore;

/**
 * Caps the number of oracle calls in flight at once.
 *
 * <p>Parallel simulation slots share one oracle; the permit count is the oracle's
 * concurrency limit. Callers block until a permit frees up.</p>
 */
@Slf4j
public class ThrottledOracle implements ConversationalOracle {

    private final ConversationalOracle delegate;
    private final Semaphore permits;

    public ThrottledOracle(ConversationalOracle delegate, int maxConcurrentCalls) {
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive, got " + maxConcurrentCalls);
        }
        this.delegate = delegate;
        this.permits = new Semaphore(maxConcurrentCalls, true);
    }

    @Override
    public String generate(List<ChatMessage> messages, int maxOutputTokens) {
        try {
            if (permits.availablePermits() == 0) {
                log.debug("Oracle at capacity, waiting for a permit");
            }
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while waiting for an oracle permit", e);
        }
        try {
            return delegate.generate(messages, maxOutputTokens);
        } finally {
            permits.release();
        }
    }

    public int availablePermits() {
        return permits.availablePermits();
    }
}
