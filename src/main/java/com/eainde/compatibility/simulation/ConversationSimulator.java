package com.eainde.compatibility.simulation;

import com.eainde.compatibility.scenario.ScenarioConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drives one scenario to a complete, strictly alternating transcript.
 *
 * <pre>
 * message = scenario.opening
 * repeat turnCount times:
 *   a = A.respond(message, last 6 turns)  → append (user_a)
 *   b = B.respond(a,       last 6 turns)  → append (user_b)
 *   message = b
 * </pre>
 */
@Slf4j
@Component
public class ConversationSimulator {

    static final int CONTEXT_WINDOW = 6;

    public List<Turn> simulate(ResponseProvider providerA, ResponseProvider providerB, ScenarioConfig scenario) {
        List<Turn> transcript = new ArrayList<>(scenario.transcriptLength());
        String message = scenario.opening();

        for (int turn = 0; turn < scenario.turnCount(); turn++) {
            String responseA = speak(providerA, Speaker.USER_A, message, transcript, scenario);
            transcript.add(new Turn(transcript.size() + 1, Speaker.USER_A, responseA));

            String responseB = speak(providerB, Speaker.USER_B, responseA, transcript, scenario);
            transcript.add(new Turn(transcript.size() + 1, Speaker.USER_B, responseB));

            message = responseB;
        }

        log.debug("Scenario {} produced {} turns", scenario.id(), transcript.size());
        return Collections.unmodifiableList(transcript);
    }

    private String speak(ResponseProvider provider, Speaker speaker, String message,
                         List<Turn> transcript, ScenarioConfig scenario) {
        int index = transcript.size() + 1;
        String response;
        try {
            response = provider.respond(message, recentContext(transcript), scenario.id());
        } catch (RuntimeException e) {
            throw new SimulationException(scenario.id(), index,
                    String.format("%s failed at turn %d of scenario %s: %s",
                            speaker.tag(), index, scenario.id(), e.getMessage()), e);
        }
        if (response == null) {
            throw new SimulationException(scenario.id(), index,
                    String.format("%s returned no message at turn %d of scenario %s",
                            speaker.tag(), index, scenario.id()), null);
        }
        return response;
    }

    private static List<Turn> recentContext(List<Turn> transcript) {
        int from = Math.max(0, transcript.size() - CONTEXT_WINDOW);
        return List.copyOf(transcript.subList(from, transcript.size()));
    }
}
