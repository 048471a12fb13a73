package com.eainde.compatibility.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Most frequent phrases first; equal counts keep first-seen order.
 */
final class FrequencyRanker {

    private FrequencyRanker() {
    }

    static List<String> top(Collection<? extends Collection<String>> groups, int limit) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Collection<String> group : groups) {
            for (String phrase : group) {
                counts.merge(phrase, 1, Integer::sum);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so ties stay in insertion order
        ranked.sort((x, y) -> Integer.compare(y.getValue(), x.getValue()));

        return ranked.stream()
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }
}
