package com.eainde.compatibility.scoring;

import com.eainde.compatibility.profile.Profile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Bonus points (0-15) earned from structured profile overlap alone.
 *
 * <pre>
 * values     Jaccard × 5   (both sets non-empty, else 0)
 * interests  Jaccard × 4   (both sets non-empty, else 0)
 * goals      min(shared × 2, 4)
 * penalty    |A.dealBreakers ∩ B.values| × 1.5
 * bonus      clamp(round(values + interests + goals − penalty, 1), 0, 15)
 * </pre>
 *
 * <p>The deal-breaker check runs one way only: A's deal breakers against B's values.
 * {@code bonus(a, b)} and {@code bonus(b, a)} can therefore differ.</p>
 */
@Slf4j
@Component
public class ProfileAlignmentCalculator {

    static final double MAX_BONUS = 15.0;

    static final double VALUES_SCALE = 5.0;
    static final double INTERESTS_SCALE = 4.0;
    static final double POINTS_PER_SHARED_GOAL = 2.0;
    static final double MAX_GOAL_POINTS = 4.0;
    static final double PENALTY_PER_DEAL_BREAKER = 1.5;

    public double bonus(Profile profileA, Profile profileB) {
        double valueComponent = jaccard(profileA.values(), profileB.values()) * VALUES_SCALE;
        double interestComponent = jaccard(profileA.interests(), profileB.interests()) * INTERESTS_SCALE;
        double goalComponent = Math.min(
                intersectionSize(profileA.relationshipGoals(), profileB.relationshipGoals()) * POINTS_PER_SHARED_GOAL,
                MAX_GOAL_POINTS);
        double penalty = intersectionSize(profileA.dealBreakers(), profileB.values()) * PENALTY_PER_DEAL_BREAKER;

        double raw = valueComponent + interestComponent + goalComponent - penalty;
        log.debug("Profile alignment: values={}, interests={}, goals={}, penalty={}",
                valueComponent, interestComponent, goalComponent, penalty);

        return Rounding.clamp(Rounding.round(raw, 1), 0.0, MAX_BONUS);
    }

    /** |a ∩ b| / |a ∪ b|, or 0 when either set is empty. */
    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersectionSize(a, b) / union.size();
    }

    private static int intersectionSize(Set<String> a, Set<String> b) {
        Set<String> shared = new HashSet<>(a);
        shared.retainAll(b);
        return shared.size();
    }
}
