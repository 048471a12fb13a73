package com.eainde.compatibility.scoring;

import com.eainde.compatibility.batch.SimulationResult;
import com.eainde.compatibility.metrics.QualityDimension;
import com.eainde.compatibility.profile.Profile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Scoring entry point: fuses batch ratings and profile overlap into a {@link CompatibilityResult}.
 *
 * <pre>
 * weighted = Σ average(d) × weight(d)            (0-10)
 * score    = min(100, round(weighted × 10 + bonus, 1))
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompatibilityScorer {

    static final int TOP_STRENGTHS = 5;
    static final int TOP_CONCERNS = 3;
    static final double MAX_SCORE = 100.0;

    private final MetricAggregator aggregator;
    private final ProfileAlignmentCalculator alignmentCalculator;
    private final ConfidenceClassifier confidenceClassifier;
    private final RecommendationGenerator recommendationGenerator;

    /**
     * @param profileA may be {@code null}, scored as an empty profile
     * @param profileB may be {@code null}, scored as an empty profile
     */
    public CompatibilityResult score(List<SimulationResult> results, Profile profileA, Profile profileB) {
        profileA = profileA == null ? Profile.empty() : profileA;
        profileB = profileB == null ? Profile.empty() : profileB;
        Map<QualityDimension, Double> averages = aggregator.aggregate(results);

        if (results.isEmpty()) {
            log.warn("No successful simulations to score, returning degenerate result");
            return new CompatibilityResult(
                    0.0,
                    MatchConfidence.LOW,
                    averages,
                    0.0,
                    List.of(),
                    List.of(),
                    recommendationGenerator.generate(0.0, List.of(), List.of()),
                    0);
        }

        double bonus = alignmentCalculator.bonus(profileA, profileB);
        double finalScore = finalScore(weightedSum(averages), bonus);

        MatchConfidence confidence = confidenceClassifier.classify(
                results.size(), profileA.confidenceScore(), profileB.confidenceScore());

        List<String> strengths = FrequencyRanker.top(
                results.stream().map(r -> r.metrics().strengths()).toList(), TOP_STRENGTHS);
        List<String> concerns = FrequencyRanker.top(
                results.stream().map(r -> r.metrics().concerns()).toList(), TOP_CONCERNS);

        log.info("Compatibility score {} ({} confidence) from {} simulations, alignment bonus {}",
                finalScore, confidence.label(), results.size(), bonus);

        return new CompatibilityResult(
                finalScore,
                confidence,
                averages,
                bonus,
                strengths,
                concerns,
                recommendationGenerator.generate(finalScore, strengths, concerns),
                results.size());
    }

    static double weightedSum(Map<QualityDimension, Double> averages) {
        double sum = 0.0;
        for (QualityDimension dimension : QualityDimension.values()) {
            sum += averages.getOrDefault(dimension, 0.0) * dimension.weight();
        }
        return sum;
    }

    static double finalScore(double weightedSum, double alignmentBonus) {
        return Math.min(MAX_SCORE, Rounding.round(weightedSum * 10 + alignmentBonus, 1));
    }
}
