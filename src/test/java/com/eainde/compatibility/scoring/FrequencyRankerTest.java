package com.eainde.compatibility.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FrequencyRankerTest {

    @Test
    @DisplayName("should rank by count and break ties by first appearance")
    void ranking() {
        List<List<String>> groups = List.of(
                List.of("listening", "humor"),
                List.of("honesty", "humor"),
                List.of("listening", "humor", "warmth"));

        assertThat(FrequencyRanker.top(groups, 3)).containsExactly("humor", "listening", "honesty");
    }

    @Test
    @DisplayName("should return fewer than the limit when fewer phrases exist")
    void fewer() {
        assertThat(FrequencyRanker.top(List.of(List.of("a")), 5)).containsExactly("a");
        assertThat(FrequencyRanker.top(List.of(), 5)).isEmpty();
    }
}
