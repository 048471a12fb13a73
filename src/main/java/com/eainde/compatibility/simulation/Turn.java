package com.eainde.compatibility.simulation;

/**
 * One utterance in a transcript.
 *
 * @param index   1-based position in the transcript
 * @param speaker who said it
 * @param message what was said
 */
public record Turn(int index, Speaker speaker, String message) {

    /** {@code user_a: message}, the line format used when a transcript is shown to the oracle. */
    public String asLine() {
        return speaker.tag() + ": " + message;
    }
}
