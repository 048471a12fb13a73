package com.eainde.compatibility.metrics;

import com.eainde.compatibility.oracle.ConversationalOracle;
import com.eainde.compatibility.scenario.ScenarioConfig;
import com.eainde.compatibility.simulation.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a finished transcript into a {@link MetricsRecord} by asking the oracle for a
 * JSON rating.
 *
 * <p>Replies are cleaned before parsing: markdown fences and any prose around the JSON
 * object are dropped. A reply that still cannot be read as the expected object yields
 * {@link MetricsRecord#neutralDefault()} so the batch carries on. Oracle transport
 * failures are not parse failures and propagate to the caller.</p>
 */
@Slf4j
@Component
public class MetricExtractor {

    static final int MAX_OUTPUT_TOKENS = 800;

    private static final String OVERALL_SCORE = "overall_score";
    private static final String SUMMARY = "summary";
    private static final String STRENGTHS = "strengths";
    private static final String CONCERNS = "concerns";

    private final ConversationalOracle oracle;
    private final ObjectMapper objectMapper;

    public MetricExtractor(ConversationalOracle oracle, ObjectMapper objectMapper) {
        this.oracle = oracle;
        this.objectMapper = objectMapper;
    }

    public MetricsRecord extract(List<Turn> transcript, ScenarioConfig scenario) {
        RatingOutcome outcome = rate(transcript, scenario);
        if (!outcome.isParsed()) {
            log.warn("Rating for scenario {} could not be parsed, using neutral default: {}",
                    scenario.id(), outcome.getParseError());
        }
        return outcome.metricsOrDefault();
    }

    public RatingOutcome rate(List<Turn> transcript, ScenarioConfig scenario) {
        String reply = oracle.generate(buildRatingPrompt(transcript, scenario), MAX_OUTPUT_TOKENS);
        return parseReply(reply);
    }

    // =========================================================================
    //  Prompt
    // =========================================================================

    String buildRatingPrompt(List<Turn> transcript, ScenarioConfig scenario) {
        String conversation = transcript.stream()
                .map(Turn::asLine)
                .collect(Collectors.joining("\n"));
        String focus = String.join(", ", scenario.focusDimensions());

        StringBuilder questions = new StringBuilder();
        StringBuilder schema = new StringBuilder();
        QualityDimension[] dimensions = QualityDimension.values();
        for (int i = 0; i < dimensions.length; i++) {
            questions.append(i + 1).append(". **").append(dimensions[i].title()).append("**: ")
                    .append(dimensions[i].question()).append('\n');
            schema.append("    \"").append(dimensions[i].key()).append("\": <0-10>,\n");
        }

        return """
                Analyze this simulated dating conversation between two people.

                Scenario: %s
                Focus Areas: %s

                Conversation:
                %s

                Rate the following aspects on a scale of 0-10:

                %s
                Scenario-Specific Evaluation for: %s

                Return your analysis as a JSON object with scores and brief reasoning:
                {
                %s    "overall_score": <0-10>,
                    "summary": "Brief 2-3 sentence summary of the interaction quality",
                    "strengths": ["strength1", "strength2"],
                    "concerns": ["concern1", "concern2"]
                }

                Be objective and realistic. Look for genuine compatibility signals, not just politeness."""
                .formatted(scenario.id(), focus, conversation, questions, focus, schema);
    }

    // =========================================================================
    //  Reply parsing
    // =========================================================================

    public RatingOutcome parseReply(String reply) {
        if (reply == null || reply.isBlank()) {
            return RatingOutcome.parseError("empty reply");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(cleanJson(reply));
        } catch (JsonProcessingException e) {
            return RatingOutcome.parseError("malformed JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return RatingOutcome.parseError("reply is not a JSON object");
        }

        Map<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            JsonNode node = root.get(dimension.key());
            if (node == null || node.isNull()) {
                continue;
            }
            Double value = readScore(node);
            if (value == null) {
                return RatingOutcome.parseError("non-numeric score for " + dimension.key() + ": " + node);
            }
            scores.put(dimension, value);
        }

        double overall = 0.0;
        JsonNode overallNode = root.get(OVERALL_SCORE);
        if (overallNode != null && !overallNode.isNull()) {
            Double value = readScore(overallNode);
            if (value == null) {
                return RatingOutcome.parseError("non-numeric overall_score: " + overallNode);
            }
            overall = value;
        }

        JsonNode summaryNode = root.get(SUMMARY);
        String summary = summaryNode != null && !summaryNode.isNull() ? summaryNode.asText() : "";

        return RatingOutcome.parsed(new MetricsRecord(
                scores, overall, summary, readPhrases(root.get(STRENGTHS)), readPhrases(root.get(CONCERNS))));
    }

    /**
     * Removes markdown fences and surrounding prose, keeping the outermost {@code {...}}.
     */
    static String cleanJson(String reply) {
        String text = reply;
        if (text.contains("```json")) {
            text = betweenFences(text, "```json");
        } else if (text.contains("```")) {
            text = betweenFences(text, "```");
        }

        int begin = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (begin >= 0 && end > begin) {
            text = text.substring(begin, end + 1);
        }
        return text.trim();
    }

    private static String betweenFences(String text, String openingFence) {
        int start = text.indexOf(openingFence) + openingFence.length();
        int close = text.indexOf("```", start);
        return close >= 0 ? text.substring(start, close) : text.substring(start);
    }

    private static Double readScore(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> readPhrases(JsonNode node) {
        List<String> phrases = new ArrayList<>();
        if (node == null || node.isNull()) {
            return phrases;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isNull() && !item.asText().isBlank()) {
                    phrases.add(item.asText().trim());
                }
            }
        } else if (node.isTextual() && !node.asText().isBlank()) {
            phrases.add(node.asText().trim());
        }
        return phrases;
    }
}
