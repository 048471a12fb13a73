package com.eainde.compatibility.profile;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scores how much of a profile has been filled in, on [0, 1].
 *
 * <p>Each facet saturates at a target count and contributes its weight pro rata:</p>
 * <pre>
 * personality traits  0.20  (5)
 * values              0.25  (4)
 * interests           0.15  (5)
 * relationship goals  0.20  (2)
 * communication style 0.10  (4 filled fields)
 * deal breakers       0.05  (2)
 * preferences         0.05  (3)
 * </pre>
 */
@Component
public class ProfileCompletenessCalculator {

    public double confidenceOf(Profile profile) {
        double score = 0.0;
        score += 0.20 * saturation(profile.personalityTraits().size(), 5);
        score += 0.25 * saturation(profile.values().size(), 4);
        score += 0.15 * saturation(profile.interests().size(), 5);
        score += 0.20 * saturation(profile.relationshipGoals().size(), 2);
        score += 0.10 * saturation(profile.communicationStyle().filledFieldCount(), CommunicationStyle.FIELD_COUNT);
        score += 0.05 * saturation(profile.dealBreakers().size(), 2);
        score += 0.05 * saturation(profile.preferences().size(), 3);

        return new BigDecimal(score).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    /** Returns a copy of the profile with its confidence score recomputed. */
    public Profile withComputedConfidence(Profile profile) {
        return profile.toBuilder().confidenceScore(confidenceOf(profile)).build();
    }

    private static double saturation(int count, int target) {
        return Math.min((double) count / target, 1.0);
    }
}
