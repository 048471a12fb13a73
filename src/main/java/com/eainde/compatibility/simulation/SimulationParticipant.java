package com.eainde.compatibility.simulation;

import com.eainde.compatibility.profile.Profile;

/**
 * A party taking part in a batch: identity, profile and the provider that speaks for it.
 */
public record SimulationParticipant(String id, Profile profile, ResponseProvider responseProvider) {

    public SimulationParticipant {
        profile = profile == null ? Profile.empty() : profile;
    }
}
