package com.eainde.compatibility.batch;

import com.eainde.compatibility.metrics.MetricExtractor;
import com.eainde.compatibility.metrics.QualityDimension;
import com.eainde.compatibility.oracle.ConversationalOracle;
import com.eainde.compatibility.oracle.OracleException;
import com.eainde.compatibility.profile.Profile;
import com.eainde.compatibility.scenario.ScenarioCatalog;
import com.eainde.compatibility.scenario.SimulationDistributor;
import com.eainde.compatibility.scoring.CompatibilityResult;
import com.eainde.compatibility.scoring.CompatibilityScorer;
import com.eainde.compatibility.scoring.ConfidenceClassifier;
import com.eainde.compatibility.scoring.MetricAggregator;
import com.eainde.compatibility.scoring.ProfileAlignmentCalculator;
import com.eainde.compatibility.scoring.RecommendationGenerator;
import com.eainde.compatibility.simulation.ConversationSimulator;
import com.eainde.compatibility.simulation.ResponseProvider;
import com.eainde.compatibility.simulation.SimulationParticipant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class BatchOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final String RATING = "{\"natural_flow\": 8, \"value_alignment\": 7, \"overall_score\": 7}";

    // Three short scenarios: 5 simulations split 2 / 2 / 1
    private final ScenarioCatalog catalog = ScenarioCatalog.builder()
            .scenario("alpha", "Open alpha.", 1)
            .scenario("beta", "Open beta.", 2)
            .scenario("gamma", "Open gamma.", 1)
            .build();

    private final ResponseProvider echo = (message, context, scenarioId) -> "reply in " + scenarioId;

    private ExecutorService pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private BatchOrchestrator orchestrator(ConversationalOracle oracle) {
        return new BatchOrchestrator(catalog, new SimulationDistributor(), new ConversationSimulator(),
                new MetricExtractor(oracle, new ObjectMapper()), null, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SimulationParticipant participant(String id, ResponseProvider provider) {
        return new SimulationParticipant(id, null, provider);
    }

    // =========================================================================
    //  Happy path
    // =========================================================================

    @Nested
    @DisplayName("Sequential batch")
    class Sequential {

        @Test
        @DisplayName("should return results in scenario order then slot order")
        void ordering() {
            List<SimulationResult> results = orchestrator((messages, max) -> RATING)
                    .runBatch(participant("a", echo), participant("b", echo), 5);

            assertThat(results).extracting(SimulationResult::scenarioId)
                    .containsExactly("alpha", "alpha", "beta", "beta", "gamma");
            assertThat(results.get(2).transcript()).hasSize(4);
            assertThat(results.get(0).createdAt()).isEqualTo(NOW);
            assertThat(results.get(0).metrics().score(QualityDimension.NATURAL_FLOW)).hasValue(8.0);
        }

        @Test
        @DisplayName("unparseable ratings should still count as successful simulations")
        void parseErrorIsNotFailure() {
            BatchReport report = orchestrator((messages, max) -> "no json at all")
                    .runBatchWithReport(participant("a", echo), participant("b", echo), 3, BatchCancellation.none());

            assertThat(report.getSuccessCount()).isEqualTo(3);
            assertThat(report.results()).allSatisfy(r -> assertThat(r.metrics().overallScore()).isEqualTo(5.0));
        }
    }

    // =========================================================================
    //  Failure isolation
    // =========================================================================

    @Nested
    @DisplayName("Failure isolation")
    class Failures {

        @Test
        @DisplayName("a failing simulation should be dropped without stopping the batch")
        void providerFailure() {
            ResponseProvider failsInBeta = (message, context, scenarioId) -> {
                if (scenarioId.equals("beta")) {
                    throw new IllegalStateException("provider down");
                }
                return "fine";
            };

            BatchReport report = orchestrator((messages, max) -> RATING)
                    .runBatchWithReport(participant("a", failsInBeta), participant("b", echo), 5,
                            BatchCancellation.none());

            assertThat(report.results()).extracting(SimulationResult::scenarioId)
                    .containsExactly("alpha", "alpha", "gamma");
            assertThat(report.getFailureCount()).isEqualTo(2);
            assertThat(report.getOutcomes()).filteredOn(o -> !o.isSuccess())
                    .extracting(SimulationOutcome::getScenarioId, SimulationOutcome::getSlot)
                    .containsExactly(
                            tuple("beta", 1),
                            tuple("beta", 2));
        }

        @Test
        @DisplayName("an oracle failure during rating should fail only that slot")
        void ratingOracleFailure() {
            BatchReport report = orchestrator((messages, max) -> {
                throw new OracleException("rate limited");
            }).runBatchWithReport(participant("a", echo), participant("b", echo), 2, BatchCancellation.none());

            assertThat(report.results()).isEmpty();
            assertThat(report.getFailureCount()).isEqualTo(2);
            assertThat(report.getOutcomes().get(0).getErrorMessage()).contains("rate limited");
        }
    }

    // =========================================================================
    //  Parallel execution
    // =========================================================================

    @Nested
    @DisplayName("Parallel batch")
    class Parallel {

        @Test
        @DisplayName("should return the same order as a sequential run")
        void sameOrder() {
            pool = Executors.newFixedThreadPool(4);
            BatchOrchestrator parallel = new BatchOrchestrator(catalog, new SimulationDistributor(),
                    new ConversationSimulator(), new MetricExtractor((messages, max) -> RATING, new ObjectMapper()),
                    pool, Clock.fixed(NOW, ZoneOffset.UTC));

            List<SimulationResult> results = parallel.runBatch(participant("a", echo), participant("b", echo), 23);

            assertThat(results).hasSize(23);
            assertThat(results).extracting(SimulationResult::scenarioId)
                    .containsExactlyElementsOf(
                            orchestrator((messages, max) -> RATING)
                                    .runBatch(participant("a", echo), participant("b", echo), 23)
                                    .stream().map(SimulationResult::scenarioId).toList());
        }

        @Test
        @DisplayName("failing slots should not disturb their siblings or the result order")
        void failureIsolation() {
            ResponseProvider failsInBeta = (message, context, scenarioId) -> {
                if (scenarioId.equals("beta")) {
                    throw new IllegalStateException("provider down");
                }
                return "fine";
            };

            BatchReport report = parallel(4).runBatchWithReport(
                    participant("a", failsInBeta), participant("b", echo), 23, BatchCancellation.none());

            // 23 over three scenarios: 8 / 8 / 7
            assertThat(report.getFailureCount()).isEqualTo(8);
            assertThat(report.getSuccessCount()).isEqualTo(15);
            assertThat(report.results()).extracting(SimulationResult::scenarioId)
                    .containsExactlyElementsOf(Stream.concat(
                            Collections.nCopies(8, "alpha").stream(),
                            Collections.nCopies(7, "gamma").stream()).toList());
            assertThat(report.getOutcomes()).extracting(SimulationOutcome::getScenarioId, SimulationOutcome::getSlot)
                    .startsWith(tuple("alpha", 1), tuple("alpha", 2))
                    .endsWith(tuple("gamma", 7));
        }

        @Test
        @DisplayName("cancelling on the pool should skip unstarted slots and leave the rest scoreable")
        void cancelledMidway() {
            BatchCancellation cancellation = BatchCancellation.none();
            AtomicBoolean first = new AtomicBoolean(true);
            CountDownLatch cancelled = new CountDownLatch(1);
            ResponseProvider cancelling = (message, context, scenarioId) -> {
                if (first.compareAndSet(true, false)) {
                    cancellation.cancel();
                    cancelled.countDown();
                } else {
                    awaitQuietly(cancelled);
                }
                return "last words";
            };

            BatchReport report = parallel(2).runBatchWithReport(
                    participant("a", cancelling), participant("b", echo), 23, cancellation);

            // at most one slot per worker was in flight when the flag flipped
            assertThat(report.getSuccessCount()).isBetween(1, 2);
            assertThat(report.getSkippedCount()).isEqualTo(23 - report.getSuccessCount());
            assertThat(report.getFailureCount()).isZero();

            CompatibilityResult result = new CompatibilityScorer(new MetricAggregator(),
                    new ProfileAlignmentCalculator(), new ConfidenceClassifier(), new RecommendationGenerator())
                    .score(report.results(), Profile.empty(), Profile.empty());

            assertThat(result.simulationCount()).isEqualTo(report.getSuccessCount());
            // natural_flow 8 x 0.10 + value_alignment 7 x 0.20
            assertThat(result.overallScore()).isEqualTo(22.0);
        }

        private BatchOrchestrator parallel(int threads) {
            pool = Executors.newFixedThreadPool(threads);
            return new BatchOrchestrator(catalog, new SimulationDistributor(), new ConversationSimulator(),
                    new MetricExtractor((messages, max) -> RATING, new ObjectMapper()),
                    pool, Clock.fixed(NOW, ZoneOffset.UTC));
        }

        private void awaitQuietly(CountDownLatch latch) {
            try {
                if (!latch.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("cancellation never happened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }

    // =========================================================================
    //  Cancellation and validation
    // =========================================================================

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("a cancelled batch should skip every slot")
        void cancelledUpFront() {
            BatchCancellation cancellation = BatchCancellation.none();
            cancellation.cancel();

            BatchReport report = orchestrator((messages, max) -> RATING)
                    .runBatchWithReport(participant("a", echo), participant("b", echo), 4, cancellation);

            assertThat(report.getSkippedCount()).isEqualTo(4);
            assertThat(report.results()).isEmpty();
        }

        @Test
        @DisplayName("cancelling mid-batch should let the running slot finish and skip the rest")
        void cancelledMidway() {
            BatchCancellation cancellation = BatchCancellation.none();
            ResponseProvider cancelling = (message, context, scenarioId) -> {
                cancellation.cancel();
                return "last words";
            };

            BatchReport report = orchestrator((messages, max) -> RATING)
                    .runBatchWithReport(participant("a", cancelling), participant("b", echo), 5, cancellation);

            assertThat(report.getSuccessCount()).isEqualTo(1);
            assertThat(report.getSkippedCount()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject a non-positive count")
        void zeroCount() {
            assertThatThrownBy(() -> orchestrator((messages, max) -> RATING)
                    .runBatch(participant("a", echo), participant("b", echo), 0))
                    .isInstanceOf(InvalidBatchRequestException.class);
        }

        @Test
        @DisplayName("should reject a missing participant or provider")
        void missingParticipant() {
            BatchOrchestrator orchestrator = orchestrator((messages, max) -> RATING);

            assertThatThrownBy(() -> orchestrator.runBatch(null, participant("b", echo), 3))
                    .isInstanceOf(InvalidBatchRequestException.class);
            assertThatThrownBy(() -> orchestrator.runBatch(participant("a", null), participant("b", echo), 3))
                    .isInstanceOf(InvalidBatchRequestException.class);
        }
    }
}
