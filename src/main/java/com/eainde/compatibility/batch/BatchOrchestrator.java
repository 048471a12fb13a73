package com.eainde.compatibility.batch;

import com.eainde.compatibility.metrics.MetricExtractor;
import com.eainde.compatibility.metrics.MetricsRecord;
import com.eainde.compatibility.scenario.ScenarioAllocation;
import com.eainde.compatibility.scenario.ScenarioCatalog;
import com.eainde.compatibility.scenario.ScenarioConfig;
import com.eainde.compatibility.scenario.SimulationDistributor;
import com.eainde.compatibility.simulation.ConversationSimulator;
import com.eainde.compatibility.simulation.SimulationParticipant;
import com.eainde.compatibility.simulation.Turn;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a full batch of simulations for one participant pair.
 *
 * <h3>Flow:</h3>
 * <pre>
 * runBatch(a, b, N)
 *   │
 *   ├── validate inputs (fatal on failure)
 *   ├── distribute N across the catalog
 *   ├── per scenario, per slot:  simulate → extract metrics
 *   │     └── any exception → slot FAILED, logged, batch continues
 *   └── successes in scenario order, then slot order
 * </pre>
 *
 * <p>Without an executor slots run one after another on the caller's thread. With one,
 * every slot is an independent task; outcomes land in a pre-sized slot array so the
 * final order never depends on completion order.</p>
 */
@Slf4j
public class BatchOrchestrator {

    static final String MDC_BATCH_ID = "batchId";
    static final String MDC_SCENARIO_ID = "scenarioId";

    private final ScenarioCatalog catalog;
    private final SimulationDistributor distributor;
    private final ConversationSimulator simulator;
    private final MetricExtractor extractor;
    private final Executor executor;
    private final Clock clock;

    public BatchOrchestrator(ScenarioCatalog catalog,
                             SimulationDistributor distributor,
                             ConversationSimulator simulator,
                             MetricExtractor extractor) {
        this(catalog, distributor, simulator, extractor, null, Clock.systemUTC());
    }

    public BatchOrchestrator(ScenarioCatalog catalog,
                             SimulationDistributor distributor,
                             ConversationSimulator simulator,
                             MetricExtractor extractor,
                             Executor executor,
                             Clock clock) {
        this.catalog = catalog;
        this.distributor = distributor;
        this.simulator = simulator;
        this.extractor = extractor;
        this.executor = executor;
        this.clock = clock;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Runs {@code requestedCount} simulations between the two participants.
     *
     * @return successful simulations only; failed slots contribute nothing
     * @throws InvalidBatchRequestException when a participant is missing or the count is not positive
     */
    public List<SimulationResult> runBatch(SimulationParticipant participantA,
                                           SimulationParticipant participantB,
                                           int requestedCount) {
        return runBatchWithReport(participantA, participantB, requestedCount, BatchCancellation.none())
                .results();
    }

    /**
     * Same as {@link #runBatch} but returns every slot's outcome and honours cancellation.
     */
    public BatchReport runBatchWithReport(SimulationParticipant participantA,
                                          SimulationParticipant participantB,
                                          int requestedCount,
                                          BatchCancellation cancellation) {
        validate(participantA, participantB, requestedCount);

        String batchId = UUID.randomUUID().toString();
        MDC.put(MDC_BATCH_ID, batchId);
        try {
            List<Slot> slots = planSlots(requestedCount);
            log.info("Starting batch {}: {} simulations for {} x {} across {} scenarios",
                    batchId, requestedCount, participantA.id(), participantB.id(), catalog.size());

            SimulationOutcome[] outcomes = executor == null
                    ? runSequentially(slots, participantA, participantB, cancellation)
                    : runConcurrently(slots, participantA, participantB, cancellation);

            BatchReport report = new BatchReport(batchId, requestedCount, Arrays.asList(outcomes));
            log.info("Batch {} complete. Succeeded: {}, Failed: {}, Skipped: {}",
                    batchId, report.getSuccessCount(), report.getFailureCount(), report.getSkippedCount());
            return report;
        } finally {
            MDC.remove(MDC_BATCH_ID);
        }
    }

    // =========================================================================
    //  Planning
    // =========================================================================

    private void validate(SimulationParticipant participantA, SimulationParticipant participantB, int requestedCount) {
        if (participantA == null || participantB == null) {
            throw new InvalidBatchRequestException("Both participants are required to run a batch");
        }
        if (participantA.responseProvider() == null || participantB.responseProvider() == null) {
            throw new InvalidBatchRequestException("Both participants need a response provider");
        }
        if (requestedCount <= 0) {
            throw new InvalidBatchRequestException("Requested simulation count must be positive, got " + requestedCount);
        }
    }

    private List<Slot> planSlots(int requestedCount) {
        List<Slot> slots = new ArrayList<>(requestedCount);
        for (ScenarioAllocation allocation : distributor.distribute(catalog, requestedCount)) {
            log.info("Running {} simulations for scenario: {}", allocation.count(), allocation.scenarioId());
            for (int i = 1; i <= allocation.count(); i++) {
                slots.add(new Slot(allocation.scenario(), i, allocation.count()));
            }
        }
        return slots;
    }

    // =========================================================================
    //  Execution
    // =========================================================================

    private SimulationOutcome[] runSequentially(List<Slot> slots,
                                                SimulationParticipant participantA,
                                                SimulationParticipant participantB,
                                                BatchCancellation cancellation) {
        SimulationOutcome[] outcomes = new SimulationOutcome[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            outcomes[i] = runOrSkip(slots.get(i), participantA, participantB, cancellation);
        }
        return outcomes;
    }

    private SimulationOutcome[] runConcurrently(List<Slot> slots,
                                                SimulationParticipant participantA,
                                                SimulationParticipant participantB,
                                                BatchCancellation cancellation) {
        List<CompletableFuture<SimulationOutcome>> futures = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            try {
                futures.add(CompletableFuture.supplyAsync(
                        () -> runOrSkip(slot, participantA, participantB, cancellation), executor));
            } catch (RejectedExecutionException e) {
                log.error("Executor rejected {}", slot, e);
                futures.add(CompletableFuture.completedFuture(
                        SimulationOutcome.failure(slot.scenario().id(), slot.index(), "rejected: " + e.getMessage())));
            }
        }

        SimulationOutcome[] outcomes = new SimulationOutcome[slots.size()];
        for (int i = 0; i < futures.size(); i++) {
            outcomes[i] = futures.get(i).join();
        }
        return outcomes;
    }

    private SimulationOutcome runOrSkip(Slot slot,
                                        SimulationParticipant participantA,
                                        SimulationParticipant participantB,
                                        BatchCancellation cancellation) {
        if (cancellation.isCancelled()) {
            log.debug("Batch cancelled, skipping {}", slot);
            return SimulationOutcome.skipped(slot.scenario().id(), slot.index());
        }
        return runSlot(slot, participantA, participantB);
    }

    /**
     * Runs one slot as an isolated unit of work. Never throws.
     */
    private SimulationOutcome runSlot(Slot slot, SimulationParticipant participantA, SimulationParticipant participantB) {
        ScenarioConfig scenario = slot.scenario();
        MDC.put(MDC_SCENARIO_ID, scenario.id());
        try {
            List<Turn> transcript = simulator.simulate(
                    participantA.responseProvider(), participantB.responseProvider(), scenario);
            MetricsRecord metrics = extractor.extract(transcript, scenario);

            SimulationResult result = new SimulationResult(scenario.id(), transcript, metrics, clock.instant());
            log.info("  Completed simulation {}/{} for {}", slot.index(), slot.scenarioTotal(), scenario.id());
            return SimulationOutcome.success(slot.index(), result);
        } catch (RuntimeException e) {
            log.warn("  Error in simulation {}/{} for {}: {}",
                    slot.index(), slot.scenarioTotal(), scenario.id(), e.getMessage(), e);
            return SimulationOutcome.failure(scenario.id(), slot.index(), e.getMessage());
        } finally {
            MDC.remove(MDC_SCENARIO_ID);
        }
    }

    private record Slot(ScenarioConfig scenario, int index, int scenarioTotal) {
        @Override
        public String toString() {
            return scenario.id() + "#" + index;
        }
    }
}
