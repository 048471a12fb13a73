package com.eainde.compatibility.scoring;

import com.eainde.compatibility.batch.SimulationResult;
import com.eainde.compatibility.metrics.QualityDimension;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Averages each quality dimension over a batch.
 *
 * <p>The denominator is always the number of results. A result whose rating lacks a
 * dimension adds 0 to that dimension's sum, so incomplete ratings pull the average
 * down. Averages are rounded to two decimals.</p>
 */
@Component
public class MetricAggregator {

    public Map<QualityDimension, Double> aggregate(List<SimulationResult> results) {
        Map<QualityDimension, Double> averages = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            if (results.isEmpty()) {
                averages.put(dimension, 0.0);
                continue;
            }
            double sum = 0.0;
            for (SimulationResult result : results) {
                sum += result.metrics().score(dimension).orElse(0.0);
            }
            averages.put(dimension, Rounding.round(sum / results.size(), 2));
        }
        return Collections.unmodifiableMap(averages);
    }
}
