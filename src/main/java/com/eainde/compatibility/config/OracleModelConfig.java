package com.eainde.compatibility.config;

import com.eainde.compatibility.oracle.ConversationalOracle;
import com.eainde.compatibility.oracle.LangChain4jOracle;
import com.eainde.compatibility.oracle.OracleCallLogger;
import com.eainde.compatibility.oracle.ThrottledOracle;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.vertexai.VertexAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Oracle wiring: a Vertex AI Gemini chat model behind a throttled {@link ConversationalOracle}.
 *
 * <pre>
 * compatibility:
 *   oracle:
 *     project: my-gcp-project
 *     location: europe-west1
 *     model-name: gemini-1.5-pro
 *     temperature: 0.7
 *     max-concurrent-calls: 4
 * </pre>
 */
@Slf4j
@Configuration
public class OracleModelConfig {

    @Value("${compatibility.oracle.project}")
    private String project;

    @Value("${compatibility.oracle.location:us-central1}")
    private String location;

    @Value("${compatibility.oracle.model-name:gemini-1.5-pro}")
    private String modelName;

    @Value("${compatibility.oracle.temperature:0.7}")
    private double temperature;

    @Value("${compatibility.oracle.max-concurrent-calls:4}")
    private int maxConcurrentCalls;

    @Bean
    public OracleCallLogger oracleCallLogger() {
        return new OracleCallLogger();
    }

    @Bean
    public ChatModel oracleChatModel(List<ChatModelListener> listeners) {
        log.info("Configuring oracle model {} in {}/{}", modelName, project, location);
        return VertexAiGeminiChatModel.builder()
                .project(project)
                .location(location)
                .modelName(modelName)
                .temperature((float) temperature)
                .listeners(listeners)
                .build();
    }

    @Bean
    public ConversationalOracle conversationalOracle(ChatModel oracleChatModel) {
        return new ThrottledOracle(new LangChain4jOracle(oracleChatModel), maxConcurrentCalls);
    }
}
