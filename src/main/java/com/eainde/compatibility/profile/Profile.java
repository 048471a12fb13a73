package com.eainde.compatibility.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Structured personality profile of one participant.
 *
 * <p>Owned and mutated outside the engine; read-only here. Missing sets become empty,
 * a missing style becomes {@link CommunicationStyle#unknown()}, and the completeness
 * score is clamped to [0, 1].</p>
 */
@Builder(toBuilder = true)
public record Profile(
        @JsonProperty("values")             Set<String> values,
        @JsonProperty("interests")          Set<String> interests,
        @JsonProperty("relationship_goals") Set<String> relationshipGoals,
        @JsonProperty("deal_breakers")      Set<String> dealBreakers,
        @JsonProperty("personality_traits") Set<String> personalityTraits,
        @JsonProperty("communication_style") CommunicationStyle communicationStyle,
        @JsonProperty("preferences")        Map<String, String> preferences,
        @JsonProperty("confidence_score")   double confidenceScore
) {

    public Profile {
        values = copyOf(values);
        interests = copyOf(interests);
        relationshipGoals = copyOf(relationshipGoals);
        dealBreakers = copyOf(dealBreakers);
        personalityTraits = copyOf(personalityTraits);
        communicationStyle = communicationStyle == null ? CommunicationStyle.unknown() : communicationStyle;
        preferences = preferences == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(preferences));
        confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
    }

    public static Profile empty() {
        return Profile.builder().build();
    }

    private static Set<String> copyOf(Set<String> source) {
        return source == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }
}
