package com.eainde.compatibility.service;

import com.eainde.compatibility.scoring.CompatibilityResult;

/**
 * Outcome of matching one pair: the verdict plus how much of the batch actually ran.
 */
public record MatchReport(
        String participantAId,
        String participantBId,
        String batchId,
        int requestedSimulations,
        int failedSimulations,
        int skippedSimulations,
        CompatibilityResult result
) {
}
