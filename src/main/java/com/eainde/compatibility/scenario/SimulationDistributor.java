package com.eainde.compatibility.scenario;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a simulation budget across the catalog.
 *
 * <p>Every scenario gets {@code total / K}; the first {@code total % K} scenarios in
 * catalog order get one more. Counts always sum to {@code total}, including when the
 * budget is smaller than the catalog and some scenarios receive nothing.</p>
 */
@Component
public class SimulationDistributor {

    public List<ScenarioAllocation> distribute(ScenarioCatalog catalog, int total) {
        if (total < 0) {
            throw new IllegalArgumentException("Simulation total must not be negative, got " + total);
        }
        if (catalog.isEmpty()) {
            throw new IllegalArgumentException("Cannot distribute simulations over an empty catalog");
        }

        List<ScenarioConfig> scenarios = catalog.scenarios();
        int base = total / scenarios.size();
        int extra = total % scenarios.size();

        List<ScenarioAllocation> allocations = new ArrayList<>(scenarios.size());
        for (int i = 0; i < scenarios.size(); i++) {
            allocations.add(new ScenarioAllocation(scenarios.get(i), base + (i < extra ? 1 : 0)));
        }
        return allocations;
    }
}
