package com.eainde.compatibility.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * How a person tends to write. Every field is optional; {@code null} means "not yet known".
 */
public record CommunicationStyle(
        @JsonProperty("formality")       String formality,
        @JsonProperty("emoji_usage")     String emojiUsage,
        @JsonProperty("response_length") String responseLength,
        @JsonProperty("humor_style")     String humorStyle
) {

    public static final int FIELD_COUNT = 4;

    public static CommunicationStyle unknown() {
        return new CommunicationStyle(null, null, null, null);
    }

    /** Number of style fields that carry a value. */
    public int filledFieldCount() {
        return (int) Stream.of(formality, emojiUsage, responseLength, humorStyle)
                .filter(Objects::nonNull)
                .count();
    }
}
