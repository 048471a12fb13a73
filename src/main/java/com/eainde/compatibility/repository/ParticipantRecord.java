package com.eainde.compatibility.repository;

import com.eainde.compatibility.profile.Profile;

import java.time.Instant;

/**
 * Stored state of one participant as the matching core sees it.
 */
public record ParticipantRecord(String id, Profile profile, Instant updatedAt) {

    public ParticipantRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Participant id must not be blank");
        }
        profile = profile == null ? Profile.empty() : profile;
    }

    public ParticipantRecord withProfile(Profile newProfile, Instant now) {
        return new ParticipantRecord(id, newProfile, now);
    }
}
