package com.eainde.compatibility.batch;

import java.util.List;

/**
 * Per-slot outcomes of one batch, in scenario order then slot order.
 */
public class BatchReport {

    private final String batchId;
    private final int requestedCount;
    private final List<SimulationOutcome> outcomes;

    public BatchReport(String batchId, int requestedCount, List<SimulationOutcome> outcomes) {
        this.batchId = batchId;
        this.requestedCount = requestedCount;
        this.outcomes = List.copyOf(outcomes);
    }

    public String getBatchId() {
        return batchId;
    }

    public int getRequestedCount() {
        return requestedCount;
    }

    public List<SimulationOutcome> getOutcomes() {
        return outcomes;
    }

    /** Successful simulations only, ready for scoring. */
    public List<SimulationResult> results() {
        return outcomes.stream()
                .filter(SimulationOutcome::isSuccess)
                .map(SimulationOutcome::getResult)
                .toList();
    }

    public int getSuccessCount() {
        return count(SimulationOutcome.Status.SUCCEEDED);
    }

    public int getFailureCount() {
        return count(SimulationOutcome.Status.FAILED);
    }

    public int getSkippedCount() {
        return count(SimulationOutcome.Status.SKIPPED);
    }

    private int count(SimulationOutcome.Status status) {
        return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
