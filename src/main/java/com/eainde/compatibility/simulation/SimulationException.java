package com.eainde.compatibility.simulation;

/**
 * A simulation could not be completed. No partial transcript survives it.
 */
public class SimulationException extends RuntimeException {

    private final String scenarioId;
    private final int turnIndex;

    public SimulationException(String scenarioId, int turnIndex, String message, Throwable cause) {
        super(message, cause);
        this.scenarioId = scenarioId;
        this.turnIndex = turnIndex;
    }

    public String getScenarioId() {
        return scenarioId;
    }

    /** 1-based transcript index of the utterance that failed. */
    public int getTurnIndex() {
        return turnIndex;
    }
}
