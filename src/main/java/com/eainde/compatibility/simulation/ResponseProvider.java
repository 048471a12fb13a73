package com.eainde.compatibility.simulation;

import java.util.List;

/**
 * Produces one participant's side of a simulated conversation.
 */
@FunctionalInterface
public interface ResponseProvider {

    /**
     * @param previousMessage the message to answer (the scenario opening on the first turn)
     * @param recentContext   the most recent transcript entries, oldest first
     * @param scenarioId      scenario being simulated
     * @return the utterance; any exception fails the enclosing simulation
     */
    String respond(String previousMessage, List<Turn> recentContext, String scenarioId);
}
