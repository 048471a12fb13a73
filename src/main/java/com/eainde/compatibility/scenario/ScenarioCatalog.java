package com.eainde.compatibility.scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of scenario templates.
 *
 * <p>Iteration order is the order scenarios were registered in. The distributor hands
 * out remainder slots in this order, so it is part of the catalog's contract.</p>
 *
 * <pre>
 * ScenarioCatalog catalog = ScenarioCatalog.builder()
 *         .scenario("humor_test", "Share jokes...", 12, "humor_compatibility", "wit")
 *         .build();
 * </pre>
 */
public final class ScenarioCatalog {

    private final Map<String, ScenarioConfig> scenarios;

    private ScenarioCatalog(Map<String, ScenarioConfig> scenarios) {
        this.scenarios = Collections.unmodifiableMap(new LinkedHashMap<>(scenarios));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The ten dating scenarios every batch is spread across.
     */
    public static ScenarioCatalog defaultCatalog() {
        return builder()
                .scenario("first_date_coffee",
                        "You're both at a cozy coffee shop for a first date. The atmosphere is relaxed "
                                + "and comfortable. Start the conversation naturally.",
                        15, "chemistry", "conversation_flow", "initial_attraction")
                .scenario("values_discussion",
                        "You're having a deeper conversation about what matters most to you in life "
                                + "and relationships. Be authentic and open.",
                        20, "value_alignment", "depth", "authenticity")
                .scenario("conflict_scenario",
                        "You're discussing where to live - one prefers the city for career opportunities, "
                                + "the other prefers suburbs for space and quiet. Navigate this difference.",
                        15, "conflict_resolution", "respect", "compromise")
                .scenario("future_planning",
                        "You're talking about where you each see yourselves in 5 years - career, "
                                + "lifestyle, relationship goals.",
                        15, "goal_alignment", "compatibility", "ambition")
                .scenario("stress_handling",
                        "One of you just had a terrible day at work - everything went wrong. "
                                + "The other is there to listen and support.",
                        12, "emotional_support", "empathy", "reliability")
                .scenario("humor_test",
                        "You're both in a playful mood. Share jokes, funny stories, or just banter. "
                                + "See if your humor clicks.",
                        12, "humor_compatibility", "playfulness", "wit")
                .scenario("vulnerability",
                        "You're sharing something you've struggled with - being emotionally open "
                                + "and vulnerable with each other.",
                        18, "emotional_depth", "vulnerability", "trust")
                .scenario("daily_life",
                        "You're discussing your typical weekday and weekend routines - how you spend "
                                + "your time, what a normal day looks like.",
                        12, "lifestyle_compatibility", "practical_alignment", "routine")
                .scenario("adventure_planning",
                        "You're planning a weekend trip together. Discuss what kind of activities "
                                + "and experiences you'd want to have.",
                        14, "adventure_compatibility", "planning_style", "interests")
                .scenario("intellectual_discussion",
                        "You're having a stimulating conversation about a topic you both find "
                                + "interesting - current events, philosophy, or a shared interest.",
                        16, "intellectual_compatibility", "curiosity", "engagement")
                .build();
    }

    /** Scenarios in catalog order. */
    public List<ScenarioConfig> scenarios() {
        return new ArrayList<>(scenarios.values());
    }

    public Optional<ScenarioConfig> find(String id) {
        return Optional.ofNullable(scenarios.get(id));
    }

    public int size() {
        return scenarios.size();
    }

    public boolean isEmpty() {
        return scenarios.isEmpty();
    }

    @Override
    public String toString() {
        return "ScenarioCatalog" + scenarios.keySet();
    }

    public static final class Builder {

        private final Map<String, ScenarioConfig> scenarios = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder scenario(String id, String opening, int turnCount, String... focusDimensions) {
            return scenario(new ScenarioConfig(id, opening, turnCount, List.of(focusDimensions)));
        }

        public Builder scenario(ScenarioConfig scenario) {
            if (scenarios.putIfAbsent(scenario.id(), scenario) != null) {
                throw new IllegalArgumentException("Duplicate scenario id: " + scenario.id());
            }
            return this;
        }

        public ScenarioCatalog build() {
            return new ScenarioCatalog(scenarios);
        }
    }
}
