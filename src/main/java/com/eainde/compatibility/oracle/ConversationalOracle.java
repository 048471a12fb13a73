package com.eainde.compatibility.oracle;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;

import java.util.List;

/**
 * Capability interface for the external reasoning service.
 *
 * <p>Used both for per-turn utterances and for structured quality ratings. Each call is
 * a blocking request/response; implementations throw {@link OracleException} when no
 * usable reply comes back.</p>
 */
public interface ConversationalOracle {

    String generate(List<ChatMessage> messages, int maxOutputTokens);

    default String generate(String prompt, int maxOutputTokens) {
        return generate(List.of(UserMessage.from(prompt)), maxOutputTokens);
    }
}
