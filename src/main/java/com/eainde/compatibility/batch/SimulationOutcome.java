package com.eainde.compatibility.batch;

/**
 * Result of one simulation slot: a {@link SimulationResult} on success, an error message
 * on failure, or nothing when the batch was cancelled before the slot started.
 */
public class SimulationOutcome {

    public enum Status { SUCCEEDED, FAILED, SKIPPED }

    private final String scenarioId;
    private final int slot;
    private final Status status;
    private final SimulationResult result;
    private final String errorMessage;

    private SimulationOutcome(String scenarioId, int slot, Status status,
                              SimulationResult result, String errorMessage) {
        this.scenarioId = scenarioId;
        this.slot = slot;
        this.status = status;
        this.result = result;
        this.errorMessage = errorMessage;
    }

    public static SimulationOutcome success(int slot, SimulationResult result) {
        return new SimulationOutcome(result.scenarioId(), slot, Status.SUCCEEDED, result, null);
    }

    public static SimulationOutcome failure(String scenarioId, int slot, String errorMessage) {
        return new SimulationOutcome(scenarioId, slot, Status.FAILED, null, errorMessage);
    }

    public static SimulationOutcome skipped(String scenarioId, int slot) {
        return new SimulationOutcome(scenarioId, slot, Status.SKIPPED, null, null);
    }

    public String getScenarioId() {
        return scenarioId;
    }

    /** 1-based slot number within its scenario. */
    public int getSlot() {
        return slot;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public SimulationResult getResult() {
        return result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return scenarioId + "#" + slot + " " + status + (errorMessage != null ? " (" + errorMessage + ")" : "");
    }
}
