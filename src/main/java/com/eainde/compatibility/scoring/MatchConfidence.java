package com.eainde.compatibility.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trust label on a compatibility result.
 */
public enum MatchConfidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String label;

    MatchConfidence(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
