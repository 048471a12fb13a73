package com.eainde.compatibility.batch;

import com.eainde.compatibility.metrics.MetricsRecord;
import com.eainde.compatibility.simulation.Turn;

import java.time.Instant;
import java.util.List;

/**
 * One completed simulation: the transcript and the oracle's rating of it.
 */
public record SimulationResult(
        String scenarioId,
        List<Turn> transcript,
        MetricsRecord metrics,
        Instant createdAt
) {

    public SimulationResult {
        transcript = List.copyOf(transcript);
    }
}
