package com.eainde.compatibility.scoring;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a final score plus ranked strengths and concerns into a short recommendation.
 */
@Component
public class RecommendationGenerator {

    public String generate(double score, List<String> strengths, List<String> concerns) {
        if (score >= 80) {
            return "Excellent match! Strong compatibility across multiple dimensions. Key strengths: "
                    + cite(strengths, 3, "great overall chemistry") + ".";
        }
        if (score >= 65) {
            return "Promising match with good potential. Notable strengths: "
                    + cite(strengths, 2, "solid connection") + ". Areas to explore: "
                    + cite(concerns, 2, "communication styles") + ".";
        }
        if (score >= 50) {
            return "Moderate compatibility. Some alignment in "
                    + cite(strengths, 2, "certain areas") + ". Consider: "
                    + cite(concerns, 2, "whether core values align") + ".";
        }
        return "Limited compatibility indicated. Consider whether "
                + cite(concerns, 3, "fundamental differences in values or communication")
                + " are surmountable.";
    }

    private static String cite(List<String> phrases, int limit, String fallback) {
        if (phrases == null || phrases.isEmpty()) {
            return fallback;
        }
        return String.join(", ", phrases.subList(0, Math.min(limit, phrases.size())));
    }
}
