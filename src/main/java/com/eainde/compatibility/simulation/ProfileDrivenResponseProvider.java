package com.eainde.compatibility.simulation;

import com.eainde.compatibility.oracle.ConversationalOracle;
import com.eainde.compatibility.oracle.OracleException;
import com.eainde.compatibility.profile.Profile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Speaks for a participant by asking the oracle how that person would answer, given
 * their profile, the scenario and the recent conversation.
 */
public class ProfileDrivenResponseProvider implements ResponseProvider {

    static final int MAX_OUTPUT_TOKENS = 300;

    private static final String PROMPT_TEMPLATE = """
            You are simulating how a real person would respond in a dating scenario.

            Person's Profile:
            %s

            Scenario: %s

            Recent Conversation:
            %s

            Latest Message to Respond To:
            %s

            Generate a natural, authentic response that this person would give based on their personality, values, and communication style.

            Guidelines:
            - Stay true to their personality traits and values
            - Use their typical communication style
            - Be realistic - include natural imperfections
            - Show their sense of humor if appropriate
            - React authentically based on their emotional intelligence
            - Keep response 1-3 sentences (natural conversation length)

            Generate ONLY the response text, nothing else.""";

    private final ConversationalOracle oracle;
    private final ObjectMapper objectMapper;
    private final String profileJson;

    public ProfileDrivenResponseProvider(ConversationalOracle oracle, ObjectMapper objectMapper, Profile profile) {
        this.oracle = oracle;
        this.objectMapper = objectMapper;
        this.profileJson = toJson(profile);
    }

    @Override
    public String respond(String previousMessage, List<Turn> recentContext, String scenarioId) {
        String prompt = buildPrompt(previousMessage, recentContext, scenarioId);
        String reply = oracle.generate(prompt, MAX_OUTPUT_TOKENS);
        if (reply == null || reply.isBlank()) {
            throw new OracleException("Empty utterance for scenario " + scenarioId);
        }
        return reply.trim();
    }

    String buildPrompt(String previousMessage, List<Turn> recentContext, String scenarioId) {
        return PROMPT_TEMPLATE.formatted(profileJson, scenarioId, contextJson(recentContext), previousMessage);
    }

    private String contextJson(List<Turn> recentContext) {
        ArrayNode turns = objectMapper.createArrayNode();
        for (Turn turn : recentContext) {
            ObjectNode node = turns.addObject();
            node.put("turn", turn.index());
            node.put("speaker", turn.speaker().tag());
            node.put("message", turn.message());
        }
        return toJson(turns);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render prompt context as JSON", e);
        }
    }
}
