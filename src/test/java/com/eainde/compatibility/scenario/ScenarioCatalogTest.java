package com.eainde.compatibility.scenario;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioCatalogTest {

    @Nested
    @DisplayName("Default catalog")
    class DefaultCatalog {

        private final ScenarioCatalog catalog = ScenarioCatalog.defaultCatalog();

        @Test
        @DisplayName("should hold the ten dating scenarios in a fixed order")
        void order() {
            assertThat(catalog.scenarios())
                    .extracting(ScenarioConfig::id)
                    .containsExactly(
                            "first_date_coffee", "values_discussion", "conflict_scenario",
                            "future_planning", "stress_handling", "humor_test",
                            "vulnerability", "daily_life", "adventure_planning",
                            "intellectual_discussion");
        }

        @Test
        @DisplayName("should carry per-scenario turn counts and focus labels")
        void turnCounts() {
            assertThat(catalog.find("values_discussion")).get()
                    .extracting(ScenarioConfig::turnCount).isEqualTo(20);
            assertThat(catalog.find("humor_test")).get()
                    .extracting(ScenarioConfig::focusDimensions)
                    .isEqualTo(List.of("humor_compatibility", "playfulness", "wit"));
            assertThat(catalog.find("stress_handling").get().transcriptLength()).isEqualTo(24);
        }

        @Test
        @DisplayName("should return empty for an unknown id")
        void unknown() {
            assertThat(catalog.find("karaoke_night")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Builder")
    class Builder {

        @Test
        @DisplayName("should keep registration order")
        void registrationOrder() {
            ScenarioCatalog catalog = ScenarioCatalog.builder()
                    .scenario("b", "open b", 2)
                    .scenario("a", "open a", 3, "x")
                    .build();

            assertThat(catalog.scenarios()).extracting(ScenarioConfig::id).containsExactly("b", "a");
            assertThat(catalog.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject duplicate ids")
        void duplicate() {
            ScenarioCatalog.Builder builder = ScenarioCatalog.builder().scenario("a", "open", 1);

            assertThatThrownBy(() -> builder.scenario("a", "again", 2))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("should reject a non-positive turn count")
        void zeroTurns() {
            assertThatThrownBy(() -> new ScenarioConfig("a", "open", 0, List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("scenarios() should not expose internal state")
        void defensiveCopy() {
            ScenarioCatalog catalog = ScenarioCatalog.builder().scenario("a", "open", 1).build();
            catalog.scenarios().clear();

            assertThat(catalog.size()).isEqualTo(1);
        }
    }
}
