package com.eainde.compatibility.scoring;

import org.springframework.stereotype.Component;

/**
 * Labels a result by sample size and profile completeness. First matching rule wins:
 * <pre>
 * simulations ≥ 80 and avg profile confidence ≥ 0.7 → high
 * simulations ≥ 50 and avg profile confidence ≥ 0.5 → medium
 * otherwise                                          → low
 * </pre>
 */
@Component
public class ConfidenceClassifier {

    public MatchConfidence classify(int simulationCount, double profileConfidenceA, double profileConfidenceB) {
        double profileConfidence = (profileConfidenceA + profileConfidenceB) / 2;

        if (simulationCount >= 80 && profileConfidence >= 0.7) {
            return MatchConfidence.HIGH;
        }
        if (simulationCount >= 50 && profileConfidence >= 0.5) {
            return MatchConfidence.MEDIUM;
        }
        return MatchConfidence.LOW;
    }
}
