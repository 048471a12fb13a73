package com.eainde.compatibility.scoring;

import com.eainde.compatibility.profile.Profile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileAlignmentCalculatorTest {

    private final ProfileAlignmentCalculator calculator = new ProfileAlignmentCalculator();

    private static Profile values(String... values) {
        return Profile.builder().values(Set.of(values)).build();
    }

    @Nested
    @DisplayName("Components")
    class Components {

        @Test
        @DisplayName("identical values should give the full 5 points")
        void identicalValues() {
            assertThat(calculator.bonus(values("family", "honesty"), values("family", "honesty"))).isEqualTo(5.0);
        }

        @Test
        @DisplayName("disjoint values should give 0")
        void disjointValues() {
            assertThat(calculator.bonus(values("family"), values("career"))).isEqualTo(0.0);
        }

        @Test
        @DisplayName("an empty side should give 0 rather than divide by zero")
        void emptySide() {
            assertThat(calculator.bonus(Profile.empty(), values("family"))).isEqualTo(0.0);
            assertThat(ProfileAlignmentCalculator.jaccard(Set.of(), Set.of())).isEqualTo(0.0);
        }

        @Test
        @DisplayName("partial overlap should use Jaccard similarity")
        void partialOverlap() {
            Profile a = values("family", "adventure", "career");
            Profile b = values("family", "adventure", "art");

            assertThat(calculator.bonus(a, b)).isEqualTo(2.5);
        }

        @Test
        @DisplayName("shared goals should score 2 each up to 4")
        void goalsCapped() {
            Profile a = Profile.builder().relationshipGoals(Set.of("marriage", "kids", "travel")).build();
            Profile b = Profile.builder().relationshipGoals(Set.of("marriage", "kids", "travel")).build();

            assertThat(calculator.bonus(a, b)).isEqualTo(4.0);
        }

        @Test
        @DisplayName("interests should scale to 4 points")
        void interests() {
            Profile a = Profile.builder().interests(Set.of("hiking", "chess")).build();
            Profile b = Profile.builder().interests(Set.of("hiking", "chess")).build();

            assertThat(calculator.bonus(a, b)).isEqualTo(4.0);
        }
    }

    @Nested
    @DisplayName("Deal breakers")
    class DealBreakers {

        private final Profile a = Profile.builder()
                .values(Set.of("family"))
                .dealBreakers(Set.of("smoking"))
                .build();
        private final Profile b = values("family", "smoking");

        @Test
        @DisplayName("A's deal breakers in B's values should cost 1.5 each")
        void penalty() {
            assertThat(calculator.bonus(a, b)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("the check should run one way only")
        void oneDirectional() {
            assertThat(calculator.bonus(b, a)).isEqualTo(2.5);
        }

        @Test
        @DisplayName("the bonus should never go below 0")
        void floor() {
            Profile picky = Profile.builder()
                    .values(Set.of("quiet"))
                    .dealBreakers(Set.of("smoking", "gambling", "lying"))
                    .build();
            Profile other = values("smoking", "gambling", "lying");

            assertThat(calculator.bonus(picky, other)).isEqualTo(0.0);
        }
    }
}
