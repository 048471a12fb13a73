package com.eainde.compatibility.scenario;

/**
 * Number of simulations allotted to one scenario of a batch.
 */
public record ScenarioAllocation(ScenarioConfig scenario, int count) {

    public String scenarioId() {
        return scenario.id();
    }
}
