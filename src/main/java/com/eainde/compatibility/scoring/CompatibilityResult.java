package com.eainde.compatibility.scoring;

import com.eainde.compatibility.metrics.QualityDimension;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final compatibility verdict for a pair.
 *
 * @param overallScore          0-100
 * @param confidence            trust label
 * @param breakdown             per-dimension averages
 * @param profileAlignmentBonus 0-15
 * @param topStrengths          up to 5, most frequent first
 * @param topConcerns           up to 3, most frequent first
 * @param recommendation        human-readable summary
 * @param simulationCount       number of results scored
 */
public record CompatibilityResult(
        @JsonProperty("overall_score")           double overallScore,
        @JsonProperty("confidence")              MatchConfidence confidence,
        @JsonProperty("breakdown")               Map<QualityDimension, Double> breakdown,
        @JsonProperty("profile_alignment_bonus") double profileAlignmentBonus,
        @JsonProperty("top_strengths")           List<String> topStrengths,
        @JsonProperty("top_concerns")            List<String> topConcerns,
        @JsonProperty("recommendation")          String recommendation,
        @JsonProperty("simulation_count")        int simulationCount
) {

    public CompatibilityResult {
        EnumMap<QualityDimension, Double> ordered = new EnumMap<>(QualityDimension.class);
        ordered.putAll(breakdown);
        breakdown = Collections.unmodifiableMap(ordered);
        topStrengths = List.copyOf(topStrengths);
        topConcerns = List.copyOf(topConcerns);
    }

    public double average(QualityDimension dimension) {
        return breakdown.getOrDefault(dimension, 0.0);
    }
}
