package com.eainde.compatibility.metrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Structured quality rating of one simulated conversation.
 *
 * <p>Scores are clamped to [0, 10]. A dimension the oracle left out is simply absent
 * from {@link #scores()}; aggregation counts it as 0.</p>
 *
 * @param scores       per-dimension scores, possibly partial
 * @param overallScore the oracle's overall rating
 * @param summary      short free-text summary
 * @param strengths    strength phrases in reply order
 * @param concerns     concern phrases in reply order
 */
public record MetricsRecord(
        Map<QualityDimension, Double> scores,
        double overallScore,
        String summary,
        List<String> strengths,
        List<String> concerns
) {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    static final double NEUTRAL_SCORE = 5.0;
    static final String NEUTRAL_SUMMARY = "Analysis unavailable";
    static final String NEUTRAL_CONCERN = "Analysis error occurred";

    public MetricsRecord {
        EnumMap<QualityDimension, Double> clamped = new EnumMap<>(QualityDimension.class);
        if (scores != null) {
            scores.forEach((dimension, value) -> {
                if (dimension != null && value != null) {
                    clamped.put(dimension, clamp(value));
                }
            });
        }
        scores = Collections.unmodifiableMap(clamped);
        overallScore = clamp(overallScore);
        summary = summary == null ? "" : summary;
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
    }

    /**
     * The fixed record substituted when the oracle's reply cannot be parsed.
     */
    public static MetricsRecord neutralDefault() {
        EnumMap<QualityDimension, Double> scores = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            scores.put(dimension, NEUTRAL_SCORE);
        }
        return new MetricsRecord(scores, NEUTRAL_SCORE, NEUTRAL_SUMMARY, List.of(), List.of(NEUTRAL_CONCERN));
    }

    public OptionalDouble score(QualityDimension dimension) {
        Double value = scores.get(dimension);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean isComplete() {
        return scores.size() == QualityDimension.values().length;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }
}
