package com.eainde.compatibility.oracle;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link ConversationalOracle} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>The output-token cap travels as a per-request parameter so one model bean serves
 * both short utterances and longer rating replies.</p>
 */
@Slf4j
public class LangChain4jOracle implements ConversationalOracle {

    private final ChatModel chatModel;

    public LangChain4jOracle(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String generate(List<ChatMessage> messages, int maxOutputTokens) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }

        ChatRequest request = ChatRequest.builder()
                .messages(messages)
                .parameters(ChatRequestParameters.builder()
                        .maxOutputTokens(maxOutputTokens)
                        .build())
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new OracleException("Oracle call failed: " + e.getMessage(), e);
        }

        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        String text = aiMessage != null ? aiMessage.text() : null;
        if (text == null || text.isBlank()) {
            throw new OracleException("Oracle returned no text content");
        }

        log.debug("Oracle replied with {} chars (finishReason={})",
                text.length(), response.finishReason());
        return text;
    }
}
