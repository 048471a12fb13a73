package com.eainde.compatibility.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The eight conversation-quality dimensions the oracle rates, with their scoring weights.
 * Weights sum to 1.00.
 */
public enum QualityDimension {
    NATURAL_FLOW("natural_flow", 0.10, "Natural Flow & Chemistry",
            "Does the conversation flow naturally? Is there spark/chemistry?"),
    VALUE_ALIGNMENT("value_alignment", 0.20, "Value Alignment",
            "Do they seem to share similar core values?"),
    EMOTIONAL_CONNECTION("emotional_connection", 0.18, "Emotional Connection",
            "Is there emotional resonance and understanding?"),
    CONFLICT_RESOLUTION("conflict_resolution", 0.12, "Conflict Resolution",
            "How well do they handle disagreement or tension? (if applicable, otherwise estimate based on communication style)"),
    HUMOR_COMPATIBILITY("humor_compatibility", 0.10, "Humor Compatibility",
            "Do they make each other laugh? Is humor well-matched?"),
    CONVERSATIONAL_DEPTH("conversational_depth", 0.10, "Conversational Depth",
            "Does the conversation go beyond surface level?"),
    MUTUAL_ENGAGEMENT("mutual_engagement", 0.08, "Mutual Engagement",
            "Are both people equally engaged and interested?"),
    LONG_TERM_POTENTIAL("long_term_potential", 0.12, "Long-term Potential",
            "Based on this interaction, would this relationship have potential?");

    private final String key;
    private final double weight;
    private final String title;
    private final String question;

    QualityDimension(String key, double weight, String title, String question) {
        this.key = key;
        this.weight = weight;
        this.title = title;
        this.question = question;
    }

    /** Field name in the oracle's JSON reply and in the score breakdown. */
    @JsonValue
    public String key() {
        return key;
    }

    public double weight() {
        return weight;
    }

    public String title() {
        return title;
    }

    public String question() {
        return question;
    }
}
