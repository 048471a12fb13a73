package com.eainde.compatibility.scenario;

import java.util.List;

/**
 * One interaction template that structures a simulated conversation.
 *
 * @param id              catalog key, e.g. {@code first_date_coffee}
 * @param opening         premise handed to the first speaker on turn 1
 * @param turnCount       number of exchanges; every exchange is one utterance per speaker
 * @param focusDimensions ordered labels the rating request asks the oracle to weigh
 */
public record ScenarioConfig(
        String id,
        String opening,
        int turnCount,
        List<String> focusDimensions
) {

    public ScenarioConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Scenario id must not be blank");
        }
        if (turnCount <= 0) {
            throw new IllegalArgumentException(
                    "Scenario '" + id + "' must have a positive turn count, got " + turnCount);
        }
        opening = opening == null ? "" : opening;
        focusDimensions = focusDimensions == null ? List.of() : List.copyOf(focusDimensions);
    }

    /** Length of a completed transcript for this scenario. */
    public int transcriptLength() {
        return turnCount * 2;
    }
}
