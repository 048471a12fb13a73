package com.eainde.compatibility.config;

import com.eainde.compatibility.batch.BatchOrchestrator;
import com.eainde.compatibility.metrics.MetricExtractor;
import com.eainde.compatibility.scenario.ScenarioCatalog;
import com.eainde.compatibility.scenario.SimulationDistributor;
import com.eainde.compatibility.simulation.ConversationSimulator;
import com.eainde.compatibility.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Batch wiring. {@code compatibility.simulation.parallelism} of 1 runs slots on the
 * caller's thread; anything larger runs them on a worker pool of that size.
 */
@Slf4j
@Configuration
public class SimulationConfig {

    @Value("${compatibility.simulation.parallelism:1}")
    private int parallelism;

    @Bean
    public ScenarioCatalog scenarioCatalog() {
        return ScenarioCatalog.defaultCatalog();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnExpression("${compatibility.simulation.parallelism:1} > 1")
    public MdcAwareExecutor simulationExecutor() {
        return new MdcAwareExecutor(parallelism, "simulation-");
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(ScenarioCatalog scenarioCatalog,
                                               SimulationDistributor distributor,
                                               ConversationSimulator simulator,
                                               MetricExtractor extractor,
                                               ObjectProvider<MdcAwareExecutor> simulationExecutor,
                                               Clock clock) {
        MdcAwareExecutor executor = simulationExecutor.getIfAvailable();
        if (executor != null) {
            log.info("Simulation slots run on {} worker threads", parallelism);
        } else {
            log.info("Simulation slots run sequentially");
        }
        return new BatchOrchestrator(scenarioCatalog, distributor, simulator, extractor, executor, clock);
    }
}
