package com.eainde.compatibility.service;

import com.eainde.compatibility.batch.BatchCancellation;
import com.eainde.compatibility.batch.BatchOrchestrator;
import com.eainde.compatibility.batch.BatchReport;
import com.eainde.compatibility.batch.InvalidBatchRequestException;
import com.eainde.compatibility.oracle.ConversationalOracle;
import com.eainde.compatibility.repository.ParticipantRecord;
import com.eainde.compatibility.repository.ParticipantRepository;
import com.eainde.compatibility.scoring.CompatibilityResult;
import com.eainde.compatibility.scoring.CompatibilityScorer;
import com.eainde.compatibility.simulation.ProfileDrivenResponseProvider;
import com.eainde.compatibility.simulation.SimulationParticipant;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Matches two stored participants: loads their profiles, simulates the batch with
 * profile-driven speakers and scores the outcome.
 *
 * <p>Both profiles must have reached {@code compatibility.matching.min-profile-confidence}
 * (default 0.3) before any simulation runs.</p>
 */
@Service
public class MatchmakingService {

    private static final Logger log = LoggerFactory.getLogger(MatchmakingService.class);

    private final ParticipantRepository participantRepository;
    private final BatchOrchestrator batchOrchestrator;
    private final CompatibilityScorer compatibilityScorer;
    private final ConversationalOracle oracle;
    private final ObjectMapper objectMapper;
    private final int defaultSimulationCount;
    private final double minProfileConfidence;

    public MatchmakingService(ParticipantRepository participantRepository,
                              BatchOrchestrator batchOrchestrator,
                              CompatibilityScorer compatibilityScorer,
                              ConversationalOracle oracle,
                              ObjectMapper objectMapper,
                              @Value("${compatibility.simulation.default-count:100}") int defaultSimulationCount,
                              @Value("${compatibility.matching.min-profile-confidence:0.3}") double minProfileConfidence) {
        this.participantRepository = participantRepository;
        this.batchOrchestrator = batchOrchestrator;
        this.compatibilityScorer = compatibilityScorer;
        this.oracle = oracle;
        this.objectMapper = objectMapper;
        this.defaultSimulationCount = defaultSimulationCount;
        this.minProfileConfidence = minProfileConfidence;
    }

    public MatchReport match(String participantAId, String participantBId) {
        return match(participantAId, participantBId, defaultSimulationCount, BatchCancellation.none());
    }

    public MatchReport match(String participantAId, String participantBId, int requestedCount) {
        return match(participantAId, participantBId, requestedCount, BatchCancellation.none());
    }

    public MatchReport match(String participantAId, String participantBId,
                             int requestedCount, BatchCancellation cancellation) {
        ParticipantRecord recordA = load(participantAId);
        ParticipantRecord recordB = load(participantBId);
        requireReady(recordA);
        requireReady(recordB);

        log.info("Matching {} with {} over {} simulations", recordA.id(), recordB.id(), requestedCount);

        BatchReport batch = batchOrchestrator.runBatchWithReport(
                toParticipant(recordA), toParticipant(recordB), requestedCount, cancellation);

        CompatibilityResult result = compatibilityScorer.score(
                batch.results(), recordA.profile(), recordB.profile());

        return new MatchReport(
                recordA.id(),
                recordB.id(),
                batch.getBatchId(),
                batch.getRequestedCount(),
                batch.getFailureCount(),
                batch.getSkippedCount(),
                result);
    }

    private ParticipantRecord load(String participantId) {
        if (participantId == null || participantId.isBlank()) {
            throw new InvalidBatchRequestException("Participant id is required");
        }
        return participantRepository.findById(participantId)
                .orElseThrow(() -> new InvalidBatchRequestException("Unknown participant: " + participantId));
    }

    private void requireReady(ParticipantRecord record) {
        double confidence = record.profile().confidenceScore();
        if (confidence < minProfileConfidence) {
            log.warn("Participant {} profile not ready: confidence {} < {}",
                    record.id(), confidence, minProfileConfidence);
            throw new InvalidBatchRequestException(String.format(Locale.ROOT,
                    "Profile of participant %s is not ready for matching (confidence %.2f, need %.2f)",
                    record.id(), confidence, minProfileConfidence));
        }
    }

    private SimulationParticipant toParticipant(ParticipantRecord record) {
        return new SimulationParticipant(
                record.id(),
                record.profile(),
                new ProfileDrivenResponseProvider(oracle, objectMapper, record.profile()));
    }
}
