package com.eainde.compatibility.oracle;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs latency and token usage of every oracle round trip.
 */
public class OracleCallLogger implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(OracleCallLogger.class);

    static final String START_TIME = "oracleStartTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Oracle request with {} message(s), maxOutputTokens={}",
                requestContext.chatRequest().messages().size(),
                requestContext.chatRequest().parameters().maxOutputTokens());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage != null) {
            log.info("Oracle responded in {}ms - tokens in={}, out={}, total={}",
                    duration,
                    usage.inputTokenCount(),
                    usage.outputTokenCount(),
                    usage.totalTokenCount());
        } else {
            log.info("Oracle responded in {}ms", duration);
        }
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.error("Oracle interaction failed", errorContext.error());
    }
}
